package examomr;

import nu.pattern.OpenCV;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static examomr.DataModels.*;
import static org.junit.jupiter.api.Assertions.*;

class PageProcessorTest {

    private final OmrConfig config = OmrConfig.builder().dpi(100).workers(2).quiet(true).build();
    private BubbleLayout layout;
    private Mat modelo;

    @BeforeAll
    static void loadNatives() {
        OpenCV.loadLocally();
    }

    @BeforeEach
    void setUp() {
        layout = SyntheticSheet.sampleLayout(1);
        modelo = SyntheticSheet.markerTemplate();
    }

    @AfterEach
    void tearDown() {
        modelo.release();
    }

    private SyntheticSheet folha(double dpi, String... marcadas) {
        SyntheticSheet s = new SyntheticSheet(config, dpi);
        for (String m : marcadas) {
            String[] p = m.split("\\|");
            s.fill(SyntheticSheet.bubble(layout, 1, p[0], p[1], p[2]));
        }
        return s;
    }

    private static Map<String, DecodedAnswer> porColuna(PageResult r) {
        Map<String, DecodedAnswer> m = new HashMap<>();
        for (DecodedAnswer a : r.answers) m.put(a.column(), a);
        return m;
    }

    private PageResult decode(Mat imagem) throws PageFailureException {
        PageProcessor processor = new PageProcessor(config, layout, modelo, null);
        try {
            return processor.decode(new RawPage(new PageInput("s01", 1, false, null), imagem));
        } finally {
            imagem.release();
        }
    }

    @Test
    void decodesChoicesAndNumberOnAStraightScan() throws Exception {
        PageResult r = decode(folha(120, "1|a|c", "2-1-1|a|Other", "2-3-5|a|Other", "2|a|Other").render(layout, 1));

        assertTrue(r.decoded);
        assertTrue(r.failures.isEmpty(), r.failures.toString());
        Map<String, DecodedAnswer> respostas = porColuna(r);
        assertEquals("c", respostas.get("1.a").value);
        assertNull(respostas.get("1.b").value);
        assertFalse(respostas.get("1.b").ambiguous);
        assertEquals("1.5", respostas.get("2.a").value);
    }

    @Test
    void decodesARotatedAndRescaledScan() throws Exception {
        PageResult r = decode(folha(150, "1|a|b", "1|b|d", "2-1-3|a|Other", "2-3-0|a|Other")
                .rotated(1.5).render(layout, 1));

        Map<String, DecodedAnswer> respostas = porColuna(r);
        assertEquals("b", respostas.get("1.a").value);
        assertEquals("d", respostas.get("1.b").value);
        assertEquals("3.0", respostas.get("2.a").value);
        assertTrue(r.alignmentConfidence >= config.markerConfidenceGate());
    }

    @Test
    void twoFilledChoicesAreReportedAsAmbiguous() throws Exception {
        PageResult r = decode(folha(120, "1|b|a", "1|b|c").render(layout, 1));

        DecodedAnswer b = porColuna(r).get("1.b");
        assertTrue(b.ambiguous);
        assertNull(b.value);
        assertEquals(1, r.failures.size());
        assertEquals(FailureReason.AMBIGUOUS_BUBBLE, r.failures.get(0).reason);
    }

    @Test
    void readingsExcludePrintedSeparators() throws Exception {
        PageResult r = decode(folha(120).render(layout, 1));

        assertEquals(layout.forPage(1).sampledBubbles().size(), r.readings.size());
        for (BubbleReading leitura : r.readings) {
            assertNotEquals(BubbleKind.SEPARATOR, leitura.bubble.kind);
        }
    }

    @Test
    void missingMarkerFailsAlignment() {
        Mat imagem = folha(120, "1|a|a").withoutMarker(Corner.TOP_RIGHT).render(layout, 1);
        assertThrows(AlignmentException.class, () -> decode(imagem));
    }

    @Test
    void pageWithoutLayoutIsAMismatch() {
        PageProcessor processor = new PageProcessor(config, layout, modelo, null);
        Mat imagem = folha(120).render(layout, 1);
        try {
            LayoutMismatchException e = assertThrows(LayoutMismatchException.class,
                    () -> processor.decode(new RawPage(new PageInput("s01", 7, false, null), imagem)));
            assertEquals(FailureReason.MISSING_LAYOUT_ENTRY, e.getReason());
        } finally {
            imagem.release();
        }
    }

    @Test
    void processTurnsFailuresIntoValues(@TempDir Path dir) throws Exception {
        Path ilegivel = dir.resolve("s02_1.png");
        Files.write(ilegivel, new byte[]{1, 2, 3});
        Path semMarcador = dir.resolve("s03_1.png");
        Mat imagem = folha(120).withoutMarker(Corner.BOTTOM_LEFT).render(layout, 1);
        Imgcodecs.imwrite(semMarcador.toString(), imagem);
        imagem.release();

        PageProcessor processor = new PageProcessor(config, layout, modelo, null);
        PageResult r1 = processor.process(new PageInput("s02", 1, false, ilegivel));
        PageResult r2 = processor.process(new PageInput("s03", 1, false, semMarcador));

        assertFalse(r1.decoded);
        assertEquals(FailureReason.IMAGE_UNREADABLE, r1.failures.get(0).reason);
        assertFalse(r2.decoded);
        assertEquals(FailureReason.ALIGNMENT_FAILED, r2.failures.get(0).reason);
        assertTrue(r2.answers.isEmpty());
    }

    @Test
    void writesOverlayWhenEnabled(@TempDir Path dir) throws Exception {
        Path arquivo = dir.resolve("s04_1.png");
        Mat imagem = folha(120, "1|a|d").render(layout, 1);
        Imgcodecs.imwrite(arquivo.toString(), imagem);
        imagem.release();

        OmrConfig comOverlay = config.toBuilder().writeOverlays(true).build();
        Path saida = dir.resolve("saida");
        PageResult r = new PageProcessor(comOverlay, layout, modelo, saida).process(new PageInput("s04", 1, false, arquivo));

        assertTrue(r.decoded, r.failures.toString());
        Path overlay = saida.resolve("page_1").resolve("s04_1.png");
        assertTrue(Files.exists(overlay));
        Mat lida = Imgcodecs.imread(overlay.toString());
        try {
            assertEquals(3, lida.channels());
            assertEquals(comOverlay.canonicalWidthPx(), lida.cols());
        } finally {
            lida.release();
        }
    }

    @Test
    void thresholdsArePerGroup() throws Exception {
        PageResult r = decode(folha(120, "1|a|a").render(layout, 1));

        ThresholdDecision d1a = r.thresholds.get(new GroupKey(1, "1", "a", GroupKey.CHOICE_GROUP));
        ThresholdDecision d1b = r.thresholds.get(new GroupKey(1, "1", "b", GroupKey.CHOICE_GROUP));
        assertTrue(d1a.gapFound);
        assertFalse(d1b.gapFound);
        assertEquals(config.thresholdClamp(), d1b.cutoff, 0.0);
    }
}
