package com.imagecube.ui;

import com.imagecube.model.AppConfig;
import com.imagecube.model.ImageFailure;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.PipelineConfig;
import com.imagecube.model.RunReport;
import com.imagecube.model.Stage;
import com.imagecube.service.PipelineException;
import com.imagecube.service.PipelineListener;
import com.imagecube.service.PipelineOrchestrator;
import com.imagecube.service.StageException;
import javafx.application.Platform;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.stage.DirectoryChooser;
import java.io.File;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class PipelineTab {

    private final PipelineOrchestrator orchestrator = PipelineOrchestrator.createDefault();

    private Task<RunReport> currentTask;

    // UI Controls
    private TextField txtInput;
    private TextField txtAngularSize, txtRa, txtDec, txtFwhm, txtThreads;
    private TextField txtReference, txtConvReference;
    private final Map<Stage, CheckBox> stageChecks = new EnumMap<>(Stage.class);
    private CheckBox chkFailFast;
    private TextArea logArea;
    private ProgressBar progressBar;
    private Button btnStart, btnCleanup;
    private Label lblStatus;

    public Tab create() {
        Tab tab = new Tab("⚙️ Pipeline");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        VBox topContainer = new VBox(10);

        HBox folderBox = new HBox(10);
        folderBox.setAlignment(Pos.CENTER_LEFT);
        txtInput = new TextField(AppConfig.getLastDirectory());
        txtInput.setPromptText("Carpeta de imágenes...");
        txtInput.setPrefWidth(350);
        Button btnBrowse = new Button("📂 Seleccionar");
        btnBrowse.setOnAction(e -> browseDir(txtInput));
        folderBox.getChildren().addAll(new Label("Carpeta FITS:"), txtInput, btnBrowse);

        GridPane paramsGrid = new GridPane();
        paramsGrid.setHgap(10); paramsGrid.setVgap(8);
        paramsGrid.setStyle("-fx-border-color: #DDD; -fx-padding: 10; -fx-background-radius: 5; -fx-border-radius: 5;");
        txtAngularSize = new TextField(String.format(Locale.US, "%.1f", AppConfig.getAngularSize())); txtAngularSize.setPrefWidth(70);
        txtRa = new TextField(); txtRa.setPromptText("auto"); txtRa.setPrefWidth(70);
        txtDec = new TextField(); txtDec.setPromptText("auto"); txtDec.setPrefWidth(70);
        txtFwhm = new TextField(); txtFwhm.setPromptText("tabla"); txtFwhm.setPrefWidth(70);
        txtThreads = new TextField(String.valueOf(AppConfig.getWorkers())); txtThreads.setPrefWidth(40);
        txtReference = new TextField(); txtReference.setPromptText("opcional"); txtReference.setPrefWidth(160);
        txtConvReference = new TextField(); txtConvReference.setPromptText("opcional"); txtConvReference.setPrefWidth(160);
        paramsGrid.add(new Label("Tamaño angular (arcsec):"), 0, 0); paramsGrid.add(txtAngularSize, 1, 0);
        paramsGrid.add(new Label("RA:"), 2, 0); paramsGrid.add(txtRa, 3, 0);
        paramsGrid.add(new Label("DEC:"), 4, 0); paramsGrid.add(txtDec, 5, 0);
        paramsGrid.add(new Label("FWHM (arcsec):"), 0, 1); paramsGrid.add(txtFwhm, 1, 1);
        paramsGrid.add(new Label("Hilos:"), 2, 1); paramsGrid.add(txtThreads, 3, 1);
        paramsGrid.add(new Label("Imagen de referencia:"), 0, 2); paramsGrid.add(txtReference, 1, 2, 3, 1);
        paramsGrid.add(new Label("Referencia convolución:"), 0, 3); paramsGrid.add(txtConvReference, 1, 3, 3, 1);

        Label lblStages = new Label("📍 Etapas");
        lblStages.setStyle("-fx-font-weight: bold;");
        HBox stagesBox = new HBox(15);
        stagesBox.setAlignment(Pos.CENTER_LEFT);
        for (Stage s : Stage.values()) {
            CheckBox chk = new CheckBox(stageLabel(s));
            chk.setSelected(AppConfig.isStageEnabled(s));
            stageChecks.put(s, chk);
            stagesBox.getChildren().add(chk);
        }
        chkFailFast = new CheckBox("🛑 Detener en el primer error");
        chkFailFast.setSelected(AppConfig.isFailFast());

        topContainer.getChildren().addAll(folderBox, paramsGrid, lblStages, stagesBox, chkFailFast, new Separator());

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        btnStart = new Button("🚀 INICIAR PIPELINE");
        btnStart.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnStart.setMaxWidth(Double.MAX_VALUE);

        btnCleanup = new Button("🧹 LIMPIAR");
        btnCleanup.setStyle("-fx-base: #F44336; -fx-text-fill: white; -fx-font-weight: bold;");
        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);
        lblStatus = new Label("Listo.");

        root.setTop(topContainer);
        root.setCenter(logArea);
        root.setBottom(new VBox(5, new HBox(10, btnStart, btnCleanup), progressBar, lblStatus));

        btnStart.setOnAction(e -> startPipeline(false));
        btnCleanup.setOnAction(e -> startPipeline(true));

        tab.setContent(root);
        return tab;
    }

    private static String stageLabel(Stage s) {
        switch (s) {
            case CONVERSION: return "Conversión";
            case REGISTRATION: return "Registro";
            case CONVOLUTION: return "Convolución";
            case RESAMPLING: return "Remuestreo";
            default: return "SEDs";
        }
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private PipelineConfig readConfig(boolean cleanup) {
        PipelineConfig.Builder b = PipelineConfig.builder()
                .directory(Paths.get(txtInput.getText().trim()))
                .angularSize(parseAngularSize(txtAngularSize.getText(), cleanup))
                .ra(optionalNumber(txtRa))
                .dec(optionalNumber(txtDec))
                .fwhm(optionalNumber(txtFwhm))
                .referenceImage(txtReference.getText())
                .convolutionReferenceImage(txtConvReference.getText())
                .workers(Integer.parseInt(txtThreads.getText().trim()))
                .failFast(chkFailFast.isSelected())
                .cleanup(cleanup);
        stageChecks.forEach((s, chk) -> b.stage(s, chk.isSelected()));
        return b.build();
    }

    // La limpieza no usa el tamano angular: un campo vacio o invalido no debe bloquearla
    static double parseAngularSize(String text, boolean cleanup) {
        String t = text == null ? "" : text.trim();
        if (!cleanup) return Double.parseDouble(t);
        try {
            return t.isEmpty() ? Double.NaN : Double.parseDouble(t);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static Double optionalNumber(TextField tf) {
        String t = tf.getText() == null ? "" : tf.getText().trim();
        return t.isEmpty() ? null : Double.valueOf(t);
    }

    private void savePreferences(PipelineConfig config) {
        AppConfig.setLastDirectory(config.directory().toString());
        AppConfig.setAngularSize(config.angularSize());
        AppConfig.setWorkers(config.workers());
        AppConfig.setFailFast(config.failFast());
        stageChecks.forEach((s, chk) -> AppConfig.setStageEnabled(s, chk.isSelected()));
    }

    private void startPipeline(boolean cleanup) {
        PipelineConfig config;
        try {
            config = readConfig(cleanup);
        } catch (NumberFormatException e) {
            logArea.appendText("❌ Valor numérico no válido: " + e.getMessage() + "\n");
            return;
        }
        if (!cleanup) savePreferences(config);
        btnStart.setDisable(true);
        btnCleanup.setDisable(true);
        logArea.appendText(cleanup ? "🧹 Limpiando " + config.directory() + "...\n" : "🚀 Pipeline sobre " + config.directory() + "\n");

        currentTask = new Task<>() {
            @Override
            protected RunReport call() {
                int totalSteps = Math.max(1, config.stages().size());
                AtomicInteger stagesDone = new AtomicInteger();
                AtomicInteger imagesDone = new AtomicInteger();
                orchestrator.setListener(new PipelineListener() {
                    private volatile int stageSize = 1;

                    @Override
                    public void stageStarted(Stage stage, int imageCount) {
                        stageSize = Math.max(1, imageCount);
                        imagesDone.set(0);
                        Platform.runLater(() -> logArea.appendText("▶ " + stageLabel(stage) + " (" + imageCount + " imágenes)\n"));
                    }

                    @Override
                    public void imageProcessed(Stage stage, ImageRecord record) {
                        int n = imagesDone.incrementAndGet();
                        updateProgress(stagesDone.get() + (double) n / stageSize, totalSteps);
                        Platform.runLater(() -> logArea.appendText("   ✅ " + record + "\n"));
                    }

                    @Override
                    public void imageFailed(StageException failure) {
                        Platform.runLater(() -> logArea.appendText("   ❌ " + failure.getMessage() + "\n"));
                    }

                    @Override
                    public void stageFinished(Stage stage) {
                        updateProgress(stagesDone.incrementAndGet(), totalSteps);
                    }
                });
                return orchestrator.run(config);
            }
        };
        progressBar.progressProperty().bind(currentTask.progressProperty());
        currentTask.setOnSucceeded(e -> {
            RunReport report = currentTask.getValue();
            for (ImageFailure f : report.failures()) logArea.appendText("⚠️ " + f + "\n");
            String msg = report.hasFailures()
                    ? "🏁 FIN con " + report.failures().size() + " errores."
                    : "🏁 FIN (" + report.imageCount() + " imágenes).";
            logArea.appendText(msg + "\n");
            lblStatus.setText(msg);
            finish();
        });
        currentTask.setOnFailed(e -> {
            Throwable ex = currentTask.getException();
            String msg = ex instanceof PipelineException ? ex.getMessage() : String.valueOf(ex);
            logArea.appendText("❌ ERROR FATAL: " + msg + "\n");
            lblStatus.setText("Abortado.");
            finish();
        });
        new Thread(currentTask).start();
    }

    private void finish() {
        progressBar.progressProperty().unbind();
        btnStart.setDisable(false);
        btnCleanup.setDisable(false);
    }
}
