package examomr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static examomr.DataModels.*;

/**
 * Junta as respostas de cada página na tabela larga (uma linha por aluno,
 * uma coluna por "{problem}.{subquestion}").
 *
 * <p>Não é thread-safe: o {@link OmrPipeline} chama {@link #fold} de uma
 * única thread, depois que todos os workers terminam, na ordem determinística
 * das páginas.
 */
public class AnswerAssembler {

    private static class Cell {
        String value;
        boolean conflicted;
        final List<PageInput> sources = new ArrayList<>();
    }

    private final MergePolicy policy;
    private final Map<String, Map<String, Cell>> cells = new TreeMap<>();
    private final Set<String> columns = new TreeSet<>(BubbleLayout.COLUMN_ORDER);
    private final List<PageFailure> conflicts = new ArrayList<>();

    public AnswerAssembler() {
        this(MergePolicy.REPLACEMENT_OR_CONFLICT);
    }

    public AnswerAssembler(MergePolicy policy) {
        this.policy = policy;
    }

    /** Registra de antemão as colunas do gabarito, para que apareçam mesmo sem resposta. */
    public void declareColumns(List<String> colunas) {
        columns.addAll(colunas);
    }

    public void fold(PageInput page, List<DecodedAnswer> respostas) {
        Map<String, Cell> linha = cells.computeIfAbsent(page.studentId, k -> new LinkedHashMap<>());
        for (DecodedAnswer r : respostas) {
            String coluna = r.column();
            columns.add(coluna);
            Cell cell = linha.get(coluna);
            boolean ocupada = cell != null;
            if (cell == null) {
                cell = new Cell();
                linha.put(coluna, cell);
            }
            MergePolicy.Action acao = policy.decide(ocupada, cell.conflicted, cell.value, r.value, page.replacement);
            switch (acao) {
                case WRITE:
                    cell.value = r.value;
                    cell.conflicted = false;
                    cell.sources.add(page);
                    break;
                case KEEP:
                    cell.sources.add(page);
                    break;
                case CONFLICT:
                    recordConflict(page, coluna, cell, r.value);
                    break;
                default:
                    throw new IllegalStateException("Ação desconhecida: " + acao);
            }
        }
    }

    private void recordConflict(PageInput page, String coluna, Cell cell, String recebido) {
        if (!cell.conflicted) {
            // a primeira ocorrência também entra no relatório
            for (PageInput origem : cell.sources) {
                conflicts.add(new PageFailure(origem.studentId, origem.page, origem.sourceName(), FailureReason.DUPLICATE_NON_REPLACEMENT,
                        coluna + ": '" + display(cell.value) + "' em conflito com '" + display(recebido) + "' de " + page.sourceName()));
            }
        }
        conflicts.add(new PageFailure(page.studentId, page.page, page.sourceName(), FailureReason.DUPLICATE_NON_REPLACEMENT,
                coluna + ": '" + display(recebido) + "' em conflito com valor já registrado"));
        cell.value = null;
        cell.conflicted = true;
        cell.sources.add(page);
    }

    private static String display(String v) {
        return v == null ? "" : v;
    }

    /** Valor da célula; null quando em branco, ambígua, em conflito ou inexistente. */
    public String valueOf(String studentId, String coluna) {
        Map<String, Cell> linha = cells.get(studentId);
        if (linha == null) return null;
        Cell c = linha.get(coluna);
        return c == null ? null : c.value;
    }

    public boolean isConflicted(String studentId, String coluna) {
        Map<String, Cell> linha = cells.get(studentId);
        Cell c = linha == null ? null : linha.get(coluna);
        return c != null && c.conflicted;
    }

    public List<String> columns() {
        return new ArrayList<>(columns);
    }

    public List<String> students() {
        return new ArrayList<>(cells.keySet());
    }

    /** Tabela consolidada: aluno → coluna → valor (células vazias omitidas). */
    public Map<String, Map<String, String>> table() {
        Map<String, Map<String, String>> tabela = new TreeMap<>();
        for (Map.Entry<String, Map<String, Cell>> e : cells.entrySet()) {
            Map<String, String> linha = new TreeMap<>(BubbleLayout.COLUMN_ORDER);
            for (Map.Entry<String, Cell> c : e.getValue().entrySet()) {
                if (c.getValue().value != null) linha.put(c.getKey(), c.getValue().value);
            }
            tabela.put(e.getKey(), Collections.unmodifiableMap(linha));
        }
        return Collections.unmodifiableMap(tabela);
    }

    public List<PageFailure> conflicts() {
        return Collections.unmodifiableList(conflicts);
    }
}
