package com.imagecube.main;

import com.imagecube.ui.ConversionFactorsTab;
import com.imagecube.ui.PipelineTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class ImageCubeApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🔭 ImageCube");

        TabPane tabPane = new TabPane();

        // ORDEN DE PESTAÑAS
        tabPane.getTabs().add(new ConversionFactorsTab().create()); // 1. Revisar calibración
        tabPane.getTabs().add(new PipelineTab().create());          // 2. Procesar

        Scene scene = new Scene(tabPane, 1024, 768);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
