package com.imagecube.ui;

import com.imagecube.model.AppConfig;
import com.imagecube.model.ConversionFactorRow;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.PipelineConfig;
import com.imagecube.service.PipelineOrchestrator;
import javafx.application.Platform;
import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.beans.property.ReadOnlyStringWrapper;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.DirectoryChooser;
import java.io.File;
import java.nio.file.Paths;
import java.util.List;

public class ConversionFactorsTab {

    private final PipelineOrchestrator orchestrator = PipelineOrchestrator.createDefault();

    private Label lblDirectory;
    private TableView<ConversionFactorRow> table;
    private TextArea txtWarnings;

    public Tab create() {
        Tab tab = new Tab("🔬 Factores de conversión");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        // HEADER
        VBox header = new VBox(10);
        header.setAlignment(Pos.CENTER);
        Label title = new Label("Factores a Jy/pixel");
        title.setFont(Font.font("System", FontWeight.BOLD, 18));
        Button btnLoad = new Button("📂 Cargar carpeta");
        btnLoad.setStyle("-fx-base: #2196F3; -fx-text-fill: white; -fx-font-weight: bold;");
        btnLoad.setOnAction(e -> loadDirectory(root));
        lblDirectory = new Label("...");
        header.getChildren().addAll(title, btnLoad, lblDirectory);

        table = new TableView<>();
        table.getColumns().add(column("Fichero", r -> r.fileName()));
        table.getColumns().add(column("Instrumento", r -> r.instrument().label()));
        TableColumn<ConversionFactorRow, Double> colWave = new TableColumn<>("λ (micron)");
        colWave.setCellValueFactory(c -> new ReadOnlyObjectWrapper<>(c.getValue().wavelengthMicrons()));
        TableColumn<ConversionFactorRow, Double> colFactor = new TableColumn<>("Factor");
        colFactor.setCellValueFactory(c -> new ReadOnlyObjectWrapper<>(c.getValue().factor()));
        table.getColumns().add(colWave);
        table.getColumns().add(colFactor);
        table.setColumnResizePolicy(TableView.CONSTRAINED_RESIZE_POLICY);

        txtWarnings = new TextArea();
        txtWarnings.setEditable(false);
        txtWarnings.setPrefRowCount(6);
        txtWarnings.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        VBox centerLayout = new VBox(15, table, new Label("⚠️ Avisos"), txtWarnings);
        centerLayout.setPadding(new Insets(20, 0, 0, 0));
        VBox.setVgrow(table, Priority.ALWAYS);

        root.setTop(header);
        root.setCenter(centerLayout);
        tab.setContent(root);
        return tab;
    }

    private TableColumn<ConversionFactorRow, String> column(String title, java.util.function.Function<ConversionFactorRow, String> f) {
        TableColumn<ConversionFactorRow, String> col = new TableColumn<>(title);
        col.setCellValueFactory(c -> new ReadOnlyStringWrapper(f.apply(c.getValue())));
        return col;
    }

    private void loadDirectory(Pane root) {
        DirectoryChooser dc = new DirectoryChooser();
        String last = AppConfig.getLastDirectory();
        if (!last.isEmpty() && new File(last).isDirectory()) dc.setInitialDirectory(new File(last));
        File dir = dc.showDialog(root.getScene().getWindow());
        if (dir == null) return;

        lblDirectory.setText("Analizando...");
        new Thread(() -> {
            try {
                PipelineConfig config = PipelineConfig.builder().directory(Paths.get(dir.getAbsolutePath())).build();
                List<ImageRecord> records = orchestrator.ingest(config);
                List<ConversionFactorRow> rows = orchestrator.conversionFactors(records);
                StringBuilder sb = new StringBuilder();
                for (ImageRecord r : records) {
                    for (String w : r.warnings()) sb.append(r.fileName()).append(": ").append(w).append("\n");
                }
                for (ConversionFactorRow row : rows) {
                    if (row.factor() == 0) sb.append(row.fileName()).append(": factor 0, no calibrable\n");
                }
                Platform.runLater(() -> {
                    lblDirectory.setText(dir.getAbsolutePath() + " (" + rows.size() + " imágenes)");
                    table.getItems().setAll(rows);
                    txtWarnings.setText(sb.toString());
                });
            } catch (Exception e) {
                Platform.runLater(() -> {
                    lblDirectory.setText("❌ " + e.getMessage());
                    table.getItems().clear();
                });
            }
        }).start();
    }
}
