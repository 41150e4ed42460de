package examomr;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static examomr.BubbleLayout.PageLayout;
import static examomr.Constants.OUTPUT_OVERLAY_EXT;
import static examomr.Constants.OUTPUT_PAGE_DIR_PREFIX;
import static examomr.DataModels.*;

/**
 * Pipeline de uma página: marcadores → alinhamento → amostragem → limiar →
 * decodificação. Só lê o gabarito e o modelo do marcador, que são
 * compartilhados entre os workers.
 */
public class PageProcessor {

    private final OmrConfig config;
    private final BubbleLayout layout;
    private final Mat markerTemplate;
    private final MarkerLocator locator;
    private final PageAligner aligner;
    private final BubbleSampler sampler;
    private final ThresholdEstimator estimator;
    private final AnswerDecoder decoder;
    private final OverlayRenderer overlayRenderer;
    private final Path overlayDir;

    /**
     * @param overlayDir pasta de saída dos overlays; null desliga o overlay
     */
    public PageProcessor(OmrConfig config, BubbleLayout layout, Mat markerTemplate, Path overlayDir) {
        this.config = config;
        this.layout = layout;
        this.markerTemplate = markerTemplate;
        this.locator = new MarkerLocator(config);
        this.aligner = new PageAligner(config);
        this.sampler = new BubbleSampler(config);
        this.estimator = new ThresholdEstimator(config);
        this.decoder = new AnswerDecoder();
        this.overlayRenderer = new OverlayRenderer(config.coordinateMapper());
        this.overlayDir = config.writeOverlays() ? overlayDir : null;
    }

    /** Carrega e processa uma página. Nunca lança: toda falha vira {@link PageFailure}. */
    public PageResult process(PageInput input) {
        long inicio = System.nanoTime();
        if (!config.quiet()) System.out.printf("➡ Processando %s%n", input);

        RawPage raw = null;
        try {
            raw = new RawPage(input, Imgcodecs.imread(input.source.toAbsolutePath().toString(), Imgcodecs.IMREAD_GRAYSCALE));
            if (raw.image.empty()) {
                return report(PageResult.failed(input,
                        PageFailure.of(input, FailureReason.IMAGE_UNREADABLE, "Não foi possível decodificar " + input.source),
                        elapsedMs(inicio)));
            }
            PageResult r = decode(raw);
            return report(r.withElapsed(elapsedMs(inicio)));
        } catch (PageFailureException e) {
            return report(PageResult.failed(input, PageFailure.of(input, e.getReason(), e.getMessage()), elapsedMs(inicio)));
        } catch (RuntimeException e) {
            System.err.printf("  ❌ Erro inesperado ao processar %s - %s%n", input.sourceName(), e);
            return PageResult.failed(input, PageFailure.of(input, FailureReason.PROCESSING_ERROR, String.valueOf(e)),
                    elapsedMs(inicio));
        } finally {
            if (raw != null) raw.release();
        }
    }

    /**
     * Decodifica uma página já carregada. A Mat da página continua sendo do chamador.
     *
     * @throws AlignmentException      marcadores ausentes ou com confiança baixa
     * @throws LayoutMismatchException página sem bolhas no gabarito, ou bolhas fora da imagem
     */
    public PageResult decode(RawPage raw) throws PageFailureException {
        PageInput input = raw.input;
        PageLayout paginaLayout = layout.forPage(input.page);
        if (paginaLayout == null) {
            throw new LayoutMismatchException("Nenhuma bolha definida para a página " + input.page);
        }

        Mat preprocessada = null;
        AlignmentResult alinhamento = null;
        try {
            preprocessada = MarkerLocator.preprocess(raw.image);
            List<MarkerMatch> marcadores = locator.locateOrFail(preprocessada, markerTemplate);
            alinhamento = aligner.align(preprocessada, marcadores);

            List<BubbleReading> leituras = sampler.sampleAll(alinhamento.aligned, paginaLayout.sampledBubbles());
            Map<GroupKey, ThresholdDecision> limiares = thresholds(leituras);

            Map<BubbleDefinition, Double> intensidades = new HashMap<>();
            for (BubbleReading r : leituras) intensidades.put(r.bubble, r.intensity);
            List<DecodedAnswer> respostas = decoder.decodePage(input.studentId, paginaLayout, intensidades, limiares);

            List<PageFailure> falhas = new ArrayList<>();
            for (DecodedAnswer a : respostas) {
                if (a.ambiguous) {
                    falhas.add(PageFailure.of(input, FailureReason.AMBIGUOUS_BUBBLE,
                            a.column() + ": mais de uma bolha marcada"));
                }
            }

            if (overlayDir != null) {
                writeOverlay(input, alinhamento.aligned, leituras, limiares, paginaLayout);
            }
            return new PageResult(input, true, alinhamento.confidence, leituras, limiares, respostas, falhas, 0L);
        } finally {
            if (preprocessada != null) preprocessada.release();
            if (alinhamento != null) alinhamento.release();
        }
    }

    Map<GroupKey, ThresholdDecision> thresholds(List<BubbleReading> leituras) {
        Map<GroupKey, List<Double>> porGrupo = new LinkedHashMap<>();
        for (BubbleReading r : leituras) {
            porGrupo.computeIfAbsent(r.bubble.groupKey(), k -> new ArrayList<>()).add(r.intensity);
        }
        Map<GroupKey, ThresholdDecision> limiares = new LinkedHashMap<>();
        for (Map.Entry<GroupKey, List<Double>> e : porGrupo.entrySet()) {
            limiares.put(e.getKey(), estimator.estimate(e.getKey(), e.getValue()));
        }
        return limiares;
    }

    private void writeOverlay(PageInput input, Mat alinhada, List<BubbleReading> leituras,
                              Map<GroupKey, ThresholdDecision> limiares, PageLayout paginaLayout) {
        List<BubbleDefinition> separadores = new ArrayList<>();
        for (BubbleDefinition b : paginaLayout.bubbles) {
            if (b.kind == BubbleKind.SEPARATOR) separadores.add(b);
        }
        Mat overlay = overlayRenderer.render(alinhada, leituras, limiares, separadores);
        try {
            overlayRenderer.write(overlay, overlayPath(input));
        } catch (IOException e) {
            // o overlay é só para auditoria: a página continua válida
            System.err.printf("  ⚠ Overlay não gravado para %s: %s%n", input.sourceName(), e.getMessage());
        } finally {
            overlay.release();
        }
    }

    Path overlayPath(PageInput input) {
        String nome = input.sourceName();
        int ponto = nome.lastIndexOf('.');
        String base = ponto > 0 ? nome.substring(0, ponto) : nome;
        return overlayDir.resolve(OUTPUT_PAGE_DIR_PREFIX + input.page).resolve(base + OUTPUT_OVERLAY_EXT);
    }

    private PageResult report(PageResult r) {
        if (config.quiet()) return r;
        if (r.decoded) {
            System.out.printf("  ✓ %s alinhada (confiança %.3f), %d itens lidos em %d ms%n",
                    r.input.sourceName(), r.alignmentConfidence, r.answers.size(), r.elapsedMs);
        }
        for (PageFailure f : r.failures) {
            System.err.printf("  ⚠ %s [%s] %s%n", r.input.sourceName(), f.reason.code, f.detail);
        }
        return r;
    }

    private static long elapsedMs(long inicio) {
        return (System.nanoTime() - inicio) / 1_000_000;
    }
}
