package com.imagecube.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Estado de una ejecucion: etapas completadas, fallos por imagen y agregados calculados. */
public class RunReport {

    private final Set<Stage> completedStages = Collections.synchronizedSet(EnumSet.noneOf(Stage.class));
    private final List<ImageFailure> failures = Collections.synchronizedList(new ArrayList<>());
    private volatile int imageCount;
    private volatile SkyPosition referencePosition;
    private volatile double commonFwhm;
    private volatile GridSpec resamplingGrid;

    public void markCompleted(Stage stage) { completedStages.add(stage); }

    public boolean isCompleted(Stage stage) { return completedStages.contains(stage); }

    public Set<Stage> completedStages() {
        synchronized (completedStages) {
            return completedStages.isEmpty() ? EnumSet.noneOf(Stage.class) : EnumSet.copyOf(completedStages);
        }
    }

    public void addFailure(ImageFailure f) { failures.add(f); }

    public List<ImageFailure> failures() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public boolean hasFailures() { return !failures.isEmpty(); }

    public int imageCount() { return imageCount; }
    public void setImageCount(int imageCount) { this.imageCount = imageCount; }

    public SkyPosition referencePosition() { return referencePosition; }
    public void setReferencePosition(SkyPosition p) { this.referencePosition = p; }

    public double commonFwhm() { return commonFwhm; }
    public void setCommonFwhm(double fwhm) { this.commonFwhm = fwhm; }

    public GridSpec resamplingGrid() { return resamplingGrid; }
    public void setResamplingGrid(GridSpec grid) { this.resamplingGrid = grid; }
}
