package com.imagecube.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_DIRECTORY = "last_directory";
    private static final String KEY_ANG_SIZE = "angular_size";
    private static final String KEY_WORKERS = "workers";
    private static final String KEY_FAIL_FAST = "fail_fast";
    private static final String KEY_STAGE_PREFIX = "stage_";

    public static String getLastDirectory() { return prefs.get(KEY_DIRECTORY, ""); }
    public static void setLastDirectory(String v) { prefs.put(KEY_DIRECTORY, v); }

    // arcsec
    public static double getAngularSize() { return prefs.getDouble(KEY_ANG_SIZE, 600.0); }
    public static void setAngularSize(double v) { prefs.putDouble(KEY_ANG_SIZE, v); }

    public static int getWorkers() { return prefs.getInt(KEY_WORKERS, 1); }
    public static void setWorkers(int v) { prefs.putInt(KEY_WORKERS, v); }

    public static boolean isFailFast() { return prefs.getBoolean(KEY_FAIL_FAST, false); }
    public static void setFailFast(boolean v) { prefs.putBoolean(KEY_FAIL_FAST, v); }

    // Todas las etapas activadas por defecto
    public static boolean isStageEnabled(Stage s) { return prefs.getBoolean(KEY_STAGE_PREFIX + s.directoryName(), true); }
    public static void setStageEnabled(Stage s, boolean v) { prefs.putBoolean(KEY_STAGE_PREFIX + s.directoryName(), v); }
}
