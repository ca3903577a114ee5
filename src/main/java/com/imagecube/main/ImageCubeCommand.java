package com.imagecube.main;

import com.imagecube.model.ConversionFactorRow;
import com.imagecube.model.ImageFailure;
import com.imagecube.model.PipelineConfig;
import com.imagecube.model.RunReport;
import com.imagecube.model.Stage;
import com.imagecube.service.PipelineException;
import com.imagecube.service.PipelineListener;
import com.imagecube.service.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Linea de comandos: imagecube --directory DIR --angular_size ARCSEC [etapas...]
 */
@Command(
        name = "imagecube",
        mixinStandardHelpOptions = true,
        version = "imagecube 1.0.0",
        description = "Homogeneiza imagenes multi-instrumento (flujo, WCS, resolucion, pixel) y construye SEDs por pixel.")
public class ImageCubeCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ImageCubeCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    @Spec
    private CommandSpec spec;

    @Option(names = "--directory", required = true, description = "Directorio con las imagenes FITS de entrada")
    private Path directory;

    @Option(names = "--angular_size", description = "Tamano angular a cubrir, en arcsec")
    private Double angularSize;

    @Option(names = "--conversion", description = "Convierte las imagenes a Jy/pixel")
    private boolean conversion;

    @Option(names = "--registration", description = "Registra cada imagen a una rejilla TAN comun")
    private boolean registration;

    @Option(names = "--convolution", description = "Convoluciona todas las imagenes a la misma resolucion")
    private boolean convolution;

    @Option(names = "--resampling", description = "Remuestrea a la rejilla comun y escribe el cubo")
    private boolean resampling;

    @Option(names = "--seds", description = "Escribe la tabla de SEDs por pixel")
    private boolean seds;

    @Option(names = "--ra", description = "RA de referencia (grados)")
    private Double ra;

    @Option(names = "--dec", description = "DEC de referencia (grados)")
    private Double dec;

    @Option(names = "--reference_image", description = "Imagen (dentro del directorio) que da la posicion de referencia")
    private String referenceImage;

    @Option(names = "--convolution_reference_image", description = "Imagen de referencia para la convolucion")
    private String convolutionReferenceImage;

    @Option(names = "--fwhm", description = "FWHM comun en arcsec; sustituye a la tabla por instrumento")
    private Double fwhm;

    @Option(names = "--conversion_factors", description = "Muestra el factor de conversion de cada imagen")
    private boolean conversionFactors;

    @Option(names = "--cleanup", description = "Borra los directorios de salida y termina")
    private boolean cleanup;

    @Option(names = "--fail_fast", description = "Aborta en el primer error de una imagen")
    private boolean failFast;

    @Option(names = "--threads", defaultValue = "1", description = "Hilos por etapa (por defecto: ${DEFAULT-VALUE})")
    private int threads;

    private final PipelineOrchestrator orchestrator;

    public ImageCubeCommand() {
        this(PipelineOrchestrator.createDefault());
    }

    public ImageCubeCommand(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    PipelineConfig toConfig() {
        return PipelineConfig.builder()
                .directory(directory)
                .angularSize(angularSize == null ? Double.NaN : angularSize)
                .stage(Stage.CONVERSION, conversion)
                .stage(Stage.REGISTRATION, registration)
                .stage(Stage.CONVOLUTION, convolution)
                .stage(Stage.RESAMPLING, resampling)
                .stage(Stage.SED, seds)
                .ra(ra)
                .dec(dec)
                .referenceImage(referenceImage)
                .convolutionReferenceImage(convolutionReferenceImage)
                .fwhm(fwhm)
                .conversionFactorsReport(conversionFactors)
                .cleanup(cleanup)
                .failFast(failFast)
                .workers(threads)
                .build();
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        orchestrator.setListener(new PipelineListener() {
            @Override
            public void conversionFactors(List<ConversionFactorRow> rows) {
                out.println(ConversionFactorRow.HEADER);
                rows.forEach(r -> out.println(r.format()));
                out.flush();
            }
        });

        RunReport report;
        try {
            report = orchestrator.run(toConfig());
        } catch (PipelineException e) {
            logger.error("{}", e.getMessage());
            err.println("ERROR: " + e.getMessage());
            err.flush();
            return EXIT_FAILED;
        }

        if (report.hasFailures()) {
            for (ImageFailure f : report.failures()) err.println("FALLO " + f);
            err.flush();
            return EXIT_FAILED;
        }
        return EXIT_OK;
    }
}
