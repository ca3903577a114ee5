package com.imagecube.service;

import com.imagecube.model.ConversionFactorRow;
import com.imagecube.model.ImageHeader;
import com.imagecube.model.ImageRecord;
import com.imagecube.model.Instrument;
import com.imagecube.model.RasterImage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.imagecube.service.Fixtures.header;
import static com.imagecube.service.Fixtures.record;
import static org.junit.jupiter.api.Assertions.*;

class FluxConversionServiceTest {

    private final FluxConversionService service = new FluxConversionService();

    @Test
    void applyScalesPixelsAndRecordsProvenance() {
        ImageHeader h = header("PXSCAL1", 1.2, "BUNIT", "MJy/sr");
        ImageRecord rec = record("irac.fits", Instrument.IRAC, 8.0, 1.2, h);
        RasterImage img = new RasterImage(new double[][]{{1, 2}, {3, 4}}, h);

        RasterImage out = service.apply(rec, img);

        double f = 3.384576e-5;
        assertEquals(4 * f, out.pixels()[1][1], 1e-15);
        assertEquals(f, out.pixels()[0][0], 1e-15);
        assertEquals("Jy/pixel", out.header().getString("BUNIT"));
        assertEquals(f, out.header().getDouble(FluxConversionService.FACTOR_KEY), 1e-15);
        assertEquals(FluxConversionService.FACTOR_COMMENT, out.header().getComment(FluxConversionService.FACTOR_KEY));
    }

    @Test
    void pacsMismatchStillUsesFactorOne() {
        ImageHeader h = header("BUNIT", "MJy/sr");
        ImageRecord rec = record("pacs.fits", Instrument.PACS, 160, 3.2, h);
        RasterImage out = service.apply(rec, new RasterImage(new double[][]{{5}}, h));
        assertEquals(5.0, out.pixels()[0][0]);
        assertEquals("Jy/pixel", out.header().getString("BUNIT"));
    }

    @Test
    void zeroFactorIsFatal() {
        ImageRecord rec = record("wise.fits", Instrument.UNKNOWN, 3.4);
        assertThrows(CalibrationException.class,
                () -> service.apply(rec, new RasterImage(new double[][]{{1}}, rec.header())));

        ImageRecord spire = record("spire.fits", Instrument.SPIRE, 300, 6.0, header("CDELT2", 6.0 / 3600));
        assertThrows(CalibrationException.class,
                () -> service.apply(spire, new RasterImage(new double[][]{{1}}, spire.header())));
    }

    @Test
    void userSuppliedFactorForUnknownInstrument() {
        ImageHeader h = header("FLUXCONV", 0.5);
        ImageRecord rec = record("wise.fits", Instrument.UNKNOWN, 3.4, 1.0, h);
        assertEquals(2.0, service.apply(rec, new RasterImage(new double[][]{{4}}, h)).pixels()[0][0]);
    }

    @Test
    void reportListsEveryImageWithoutFailing() {
        List<ConversionFactorRow> rows = service.report(List.of(
                record("pacs.fits", Instrument.PACS, 70),
                record("wise.fits", Instrument.UNKNOWN, 3.4)));
        assertEquals(2, rows.size());
        assertEquals(1.0, rows.get(0).factor());
        assertEquals(0.0, rows.get(1).factor());
        assertEquals("PACS\t70.0\t1.0", rows.get(0).format());
    }
}
