package com.imagecube.service;

import com.imagecube.model.ConversionFactorRow;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.Stage;

import java.util.List;

/** Avisos de progreso para la UI o la linea de comandos. Todos opcionales. */
public interface PipelineListener {

    PipelineListener NONE = new PipelineListener() {
    };

    default void stageStarted(Stage stage, int imageCount) {
    }

    default void imageProcessed(Stage stage, ImageRecord record) {
    }

    default void imageFailed(StageException failure) {
    }

    default void stageFinished(Stage stage) {
    }

    default void conversionFactors(List<ConversionFactorRow> rows) {
    }
}
