package com.imagecube.main;

import picocli.CommandLine;

public class ImageCubeCli {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ImageCubeCommand()).execute(args);
        System.exit(exitCode);
    }
}
