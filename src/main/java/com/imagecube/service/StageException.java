package com.imagecube.service;

import com.imagecube.model.Stage;

/** Fallo de una sola imagen dentro de una etapa. */
public class StageException extends PipelineException {

    private final Stage stage;
    private final String fileName;
    private final String reason;

    public StageException(Stage stage, String fileName, String message) {
        super(format(stage, fileName, message));
        this.stage = stage;
        this.fileName = fileName;
        this.reason = message;
    }

    public StageException(Stage stage, String fileName, String message, Throwable cause) {
        super(format(stage, fileName, message), cause);
        this.stage = stage;
        this.fileName = fileName;
        this.reason = message;
    }

    public Stage getStage() {
        return stage;
    }

    public String getFileName() {
        return fileName;
    }

    public String getReason() {
        return reason;
    }

    private static String format(Stage stage, String fileName, String message) {
        return "[" + stage + "] " + fileName + ": " + message;
    }
}
