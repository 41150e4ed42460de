package examomr;

import nu.pattern.OpenCV;
import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static examomr.Constants.OUTPUT_DIR_SUFFIX;
import static examomr.DataModels.*;

/**
 * Processa um lote de páginas: decodificação em paralelo, uma página por
 * tarefa, seguida da junção das respostas numa única thread.
 */
public class OmrPipeline {

    static {
        OpenCV.loadLocally();
    }

    /** Resultado de um lote. */
    public static class OmrBatchResult {
        public final AnswerAssembler answers;
        public final List<PageResult> pages;
        public final List<PageFailure> failures;
        public final int processed;
        public final int skipped;
        public final long totalPageTimeMs;
        public final long wallTimeMs;

        public OmrBatchResult(AnswerAssembler answers, List<PageResult> pages, List<PageFailure> failures,
                              int processed, int skipped, long totalPageTimeMs, long wallTimeMs) {
            this.answers = answers;
            this.pages = Collections.unmodifiableList(pages);
            this.failures = Collections.unmodifiableList(failures);
            this.processed = processed;
            this.skipped = skipped;
            this.totalPageTimeMs = totalPageTimeMs;
            this.wallTimeMs = wallTimeMs;
        }

        /** Tabela consolidada: aluno → coluna → valor. */
        public Map<String, Map<String, String>> table() {
            return answers.table();
        }

        public long averagePageTimeMs() {
            return processed == 0 ? 0 : totalPageTimeMs / processed;
        }
    }

    private final OmrConfig config;
    private final BubbleLayout layout;
    private final PageProcessor processor;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @param markerTemplate modelo do marcador, só lido pelos workers; o chamador libera
     * @param outputDir      pasta dos overlays; pode ser null quando não há overlay
     */
    public OmrPipeline(OmrConfig config, BubbleLayout layout, Mat markerTemplate, Path outputDir) {
        this.config = config;
        this.layout = layout;
        this.processor = new PageProcessor(config, layout, markerTemplate, outputDir);
    }

    /** Para de despachar páginas novas; as que já começaram terminam normalmente. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public OmrBatchResult run(List<PageInput> entradas) {
        long inicio = System.nanoTime();
        List<PageInput> ordenadas = new ArrayList<>(entradas);
        ordenadas.sort(PageInput.ORDER);

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.workers(), Math.max(1, ordenadas.size())));
        List<Future<PageResult>> futuros = new ArrayList<>();
        try {
            for (PageInput entrada : ordenadas) {
                futuros.add(pool.submit(() -> cancelled.get() ? null : processor.process(entrada)));
            }
        } finally {
            pool.shutdown();
        }

        List<PageResult> resultados = new ArrayList<>();
        int puladas = 0;
        boolean interrompido = false;
        for (int i = 0; i < futuros.size(); i++) {
            Future<PageResult> futuro = futuros.get(i);
            PageInput entrada = ordenadas.get(i);
            PageResult r;
            while (true) {
                try {
                    r = futuro.get();
                    break;
                } catch (InterruptedException e) {
                    // páginas em andamento terminam; as que ainda não começaram são puladas
                    interrompido = true;
                    cancel();
                } catch (ExecutionException e) {
                    // process() não lança; só chega aqui com Error dentro do worker
                    System.err.printf("  ❌ Erro inesperado ao processar %s - %s%n", entrada.sourceName(), e.getCause());
                    r = PageResult.failed(entrada,
                            PageFailure.of(entrada, FailureReason.PROCESSING_ERROR, String.valueOf(e.getCause())), 0L);
                    break;
                }
            }
            if (r == null) {
                puladas++;
            } else {
                resultados.add(r);
            }
        }
        if (interrompido) {
            Thread.currentThread().interrupt();
        }
        return merge(resultados, puladas, (System.nanoTime() - inicio) / 1_000_000);
    }

    /** Junção em thread única, na ordem das entradas: o resultado não depende do agendamento. */
    OmrBatchResult merge(List<PageResult> resultados, int puladas, long wallTimeMs) {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.declareColumns(layout.columns());

        List<PageResult> ordenados = new ArrayList<>(resultados);
        ordenados.sort((a, b) -> PageInput.ORDER.compare(a.input, b.input));

        List<PageFailure> falhas = new ArrayList<>();
        long tempoTotal = 0;
        for (PageResult r : ordenados) {
            falhas.addAll(r.failures);
            tempoTotal += r.elapsedMs;
            if (r.decoded) assembler.fold(r.input, r.answers);
        }
        falhas.addAll(assembler.conflicts());
        falhas.sort(PageFailure.ORDER);
        return new OmrBatchResult(assembler, ordenados, falhas, ordenados.size(), puladas, tempoTotal, wallTimeMs);
    }

    /**
     * Execução completa a partir dos arquivos: carrega gabarito e marcador,
     * varre a pasta de páginas, processa e grava as saídas.
     *
     * @param outputDir pasta de saída; null usa {@code {pasta}_OMR} ao lado da pasta de páginas
     */
    public static OmrBatchResult run(OmrConfig config, Path markerImage, Path bubblesCsv, Path pagesFolder, Path outputDir)
            throws ConfigurationException, IOException {
        BubbleLayout layout = ConfigLoader.loadBubbleLayout(bubblesCsv);
        List<PageInput> entradas = new PageFolderScanner(config.quiet()).scan(pagesFolder);
        Path saida = outputDir != null ? outputDir : defaultOutputDir(pagesFolder);

        Mat modelo = ConfigLoader.loadMarkerTemplate(markerImage);
        try {
            OmrPipeline pipeline = new OmrPipeline(config, layout, modelo, saida);
            OmrBatchResult resultado = pipeline.run(entradas);
            new ResultWriter(saida).writeAll(resultado);
            return resultado;
        } finally {
            modelo.release();
        }
    }

    public static Path defaultOutputDir(Path pagesFolder) {
        Path absoluta = pagesFolder.toAbsolutePath().normalize();
        return absoluta.resolveSibling(absoluta.getFileName() + OUTPUT_DIR_SUFFIX);
    }
}
