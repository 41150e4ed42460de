package examomr;

import examomr.OmrPipeline.OmrBatchResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import static examomr.Constants.*;
import static examomr.DataModels.*;

/** Grava as saídas CSV de um lote. */
public class ResultWriter {

    private final Path outputDir;

    public ResultWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public void writeAll(OmrBatchResult resultado) throws IOException {
        Files.createDirectories(outputDir);
        writeConsolidated(resultado.answers);
        writePageAudits(resultado.pages);
        writeFailures(resultado.failures);
    }

    /** Uma linha por aluno, uma coluna por item; célula vazia = em branco, ambígua ou em conflito. */
    public Path writeConsolidated(AnswerAssembler answers) throws IOException {
        Path caminho = outputDir.resolve(OUTPUT_CONSOLIDATED);
        List<String> colunas = answers.columns();
        Map<String, Map<String, String>> tabela = answers.table();

        try (BufferedWriter bw = Files.newBufferedWriter(caminho, StandardCharsets.UTF_8)) {
            StringBuilder header = new StringBuilder("student_id");
            for (String coluna : colunas) {
                header.append(",").append(escape(coluna));
            }
            bw.write(header.toString());
            bw.newLine();

            for (Map.Entry<String, Map<String, String>> entry : tabela.entrySet()) {
                StringBuilder linha = new StringBuilder(escape(entry.getKey()));
                for (String coluna : colunas) {
                    linha.append(",").append(escape(entry.getValue().getOrDefault(coluna, "")));
                }
                bw.write(linha.toString());
                bw.newLine();
            }
        }
        return caminho;
    }

    /** {@code page_{n}/{n}_OMR.csv}: uma linha por bolha lida, para auditoria. */
    public void writePageAudits(List<PageResult> paginas) throws IOException {
        Map<Integer, List<PageResult>> porPagina = new TreeMap<>();
        for (PageResult r : paginas) {
            if (r.decoded) porPagina.computeIfAbsent(r.input.page, k -> new ArrayList<>()).add(r);
        }
        for (Map.Entry<Integer, List<PageResult>> e : porPagina.entrySet()) {
            int n = e.getKey();
            Path pasta = outputDir.resolve(OUTPUT_PAGE_DIR_PREFIX + n);
            Files.createDirectories(pasta);
            try (BufferedWriter bw = Files.newBufferedWriter(pasta.resolve(n + OUTPUT_PAGE_CSV_SUFFIX), StandardCharsets.UTF_8)) {
                bw.write("student_id,source,replacement,bubble,intensity,cutoff,filled");
                bw.newLine();
                for (PageResult r : e.getValue()) {
                    for (BubbleReading leitura : r.readings) {
                        ThresholdDecision d = r.thresholds.get(leitura.bubble.groupKey());
                        double corte = d == null ? Double.NaN : d.cutoff;
                        boolean marcada = d != null && d.isFilled(leitura.intensity);
                        bw.write(String.join(",",
                                escape(r.input.studentId),
                                escape(r.input.sourceName()),
                                String.valueOf(r.input.replacement),
                                escape(leitura.bubble.bubbleId()),
                                String.format(Locale.ROOT, "%.2f", leitura.intensity),
                                String.format(Locale.ROOT, "%.2f", corte),
                                String.valueOf(marcada)));
                        bw.newLine();
                    }
                }
            }
        }
    }

    public Path writeFailures(List<PageFailure> falhas) throws IOException {
        Path caminho = outputDir.resolve(OUTPUT_FAILURES);
        try (BufferedWriter bw = Files.newBufferedWriter(caminho, StandardCharsets.UTF_8)) {
            bw.write("student_id,page,source,reason,detail");
            bw.newLine();
            for (PageFailure f : falhas) {
                bw.write(escape(f.studentId) + "," + f.page + "," + escape(f.source) + ","
                        + f.reason.code + "," + escape(f.detail));
                bw.newLine();
            }
        }
        return caminho;
    }

    /** Aspas quando o campo tem vírgula, aspas ou quebra de linha. */
    static String escape(String campo) {
        if (campo == null) return "";
        if (campo.indexOf(',') < 0 && campo.indexOf('"') < 0 && campo.indexOf('\n') < 0 && campo.indexOf('\r') < 0) {
            return campo;
        }
        return "\"" + campo.replace("\"", "\"\"") + "\"";
    }
}
