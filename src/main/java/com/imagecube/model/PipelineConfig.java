package com.imagecube.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Parametros de una ejecucion. Inmutable; se construye una vez (CLI o UI)
 * y se pasa a cada etapa.
 */
public record PipelineConfig(Path directory,
                             double angularSize,
                             Set<Stage> stages,
                             Double ra,
                             Double dec,
                             String referenceImage,
                             String convolutionReferenceImage,
                             Double fwhm,
                             boolean conversionFactorsReport,
                             boolean cleanup,
                             boolean failFast,
                             int workers) {

    public PipelineConfig {
        stages = stages.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Stage.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(stages));
    }

    public boolean isEnabled(Stage stage) {
        return stages.contains(stage);
    }

    public OptionalDouble raOverride() {
        return ra == null ? OptionalDouble.empty() : OptionalDouble.of(ra);
    }

    public OptionalDouble decOverride() {
        return dec == null ? OptionalDouble.empty() : OptionalDouble.of(dec);
    }

    public OptionalDouble fwhmOverride() {
        return fwhm == null ? OptionalDouble.empty() : OptionalDouble.of(fwhm);
    }

    public Optional<Path> referenceImagePath() {
        return isBlank(referenceImage) ? Optional.empty() : Optional.of(directory.resolve(referenceImage));
    }

    public Optional<Path> convolutionReferenceImagePath() {
        return isBlank(convolutionReferenceImage) ? Optional.empty() : Optional.of(directory.resolve(convolutionReferenceImage));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static class Builder {
        private Path directory;
        private double angularSize;
        private final Set<Stage> stages = EnumSet.noneOf(Stage.class);
        private Double ra, dec, fwhm;
        private String referenceImage, convolutionReferenceImage;
        private boolean conversionFactorsReport, cleanup, failFast;
        private int workers = 1;

        public Builder directory(Path v) { this.directory = v; return this; }
        public Builder angularSize(double v) { this.angularSize = v; return this; }
        public Builder stage(Stage s, boolean enabled) { if (enabled) stages.add(s); else stages.remove(s); return this; }
        public Builder allStages() { stages.addAll(EnumSet.allOf(Stage.class)); return this; }
        public Builder ra(Double v) { this.ra = v; return this; }
        public Builder dec(Double v) { this.dec = v; return this; }
        public Builder fwhm(Double v) { this.fwhm = v; return this; }
        public Builder referenceImage(String v) { this.referenceImage = v; return this; }
        public Builder convolutionReferenceImage(String v) { this.convolutionReferenceImage = v; return this; }
        public Builder conversionFactorsReport(boolean v) { this.conversionFactorsReport = v; return this; }
        public Builder cleanup(boolean v) { this.cleanup = v; return this; }
        public Builder failFast(boolean v) { this.failFast = v; return this; }
        public Builder workers(int v) { this.workers = v; return this; }

        public PipelineConfig build() {
            return new PipelineConfig(directory, angularSize, stages, ra, dec, referenceImage,
                    convolutionReferenceImage, fwhm, conversionFactorsReport, cleanup, failFast, workers);
        }
    }
}
