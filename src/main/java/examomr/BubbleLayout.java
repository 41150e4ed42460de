package examomr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static examomr.Constants.*;
import static examomr.DataModels.*;

/**
 * Tabela validada de bolhas do gabarito, carregada uma vez e somente leitura.
 * Os grupos de decisão (alternativas de um item, ou uma posição de dígito)
 * são calculados aqui e reutilizados pelo limiar e pelo decodificador.
 */
public class BubbleLayout {

    // "1-2-5": problema 1, posição 2, dígito 5
    private static final Pattern SLOT_WITH_LABEL = Pattern.compile("^([^-]+)-(\\d+)-([0-9]|D|S)$");
    // "1-2" com o dígito na coluna choice
    private static final Pattern SLOT_ONLY = Pattern.compile("^([^-]+)-(\\d+)$");
    private static final Pattern DIGIT_LABEL = Pattern.compile("^([0-9]|D|S)$");

    public static final Comparator<String> COLUMN_ORDER = BubbleLayout::compareColumns;

    private final List<BubbleDefinition> bubbles;
    private final Map<Integer, PageLayout> pages = new TreeMap<>();

    public BubbleLayout(List<BubbleDefinition> definicoes) {
        Set<BubbleDefinition> vistos = new HashSet<>();
        for (BubbleDefinition b : definicoes) {
            if (!vistos.add(b)) {
                throw new IllegalArgumentException("Bolha duplicada no gabarito: página " + b.page
                        + ", questão " + b.question + ", item " + b.subquestion + ", alternativa " + b.choice);
            }
        }
        List<BubbleDefinition> todas = markSeparatorSlots(definicoes);
        this.bubbles = Collections.unmodifiableList(todas);

        Map<Integer, List<BubbleDefinition>> porPagina = new TreeMap<>();
        for (BubbleDefinition b : todas) {
            porPagina.computeIfAbsent(b.page, k -> new ArrayList<>()).add(b);
        }
        for (Map.Entry<Integer, List<BubbleDefinition>> e : porPagina.entrySet()) {
            pages.put(e.getKey(), new PageLayout(e.getKey(), e.getValue()));
        }
    }

    /**
     * Classifica uma linha da tabela (page, question, subquestion, choice, Xpos, Ypos).
     * Posições numéricas aceitam "problema-posição-dígito" ou "problema-posição" com o
     * dígito na coluna choice.
     */
    public static BubbleDefinition define(int page, String question, String subquestion, String choice, double x, double y) {
        if (page < 1) throw new IllegalArgumentException("Página inválida: " + page);
        if (isBlank(question) || isBlank(subquestion) || isBlank(choice)) {
            throw new IllegalArgumentException("Questão, item e alternativa são obrigatórios");
        }
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Coordenadas inválidas: " + x + ", " + y);
        }
        question = question.trim(); subquestion = subquestion.trim(); choice = choice.trim();

        Matcher m = SLOT_WITH_LABEL.matcher(question);
        if (m.matches()) {
            return new BubbleDefinition(page, question, subquestion, choice, m.group(1),
                    Integer.parseInt(m.group(2)), m.group(3), BubbleKind.DIGIT, x, y);
        }
        m = SLOT_ONLY.matcher(question);
        if (m.matches()) {
            if (!DIGIT_LABEL.matcher(choice).matches()) {
                throw new IllegalArgumentException("Posição numérica '" + question + "' com alternativa inválida: " + choice);
            }
            return new BubbleDefinition(page, question, subquestion, choice, m.group(1),
                    Integer.parseInt(m.group(2)), choice, BubbleKind.DIGIT, x, y);
        }
        return new BubbleDefinition(page, question, subquestion, choice, question,
                GroupKey.CHOICE_GROUP, choice, BubbleKind.CHOICE, x, y);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean isSeparatorLabel(String label) {
        return DECIMAL_LABEL.equals(label) || SLASH_LABEL.equals(label);
    }

    // Posições só com D/S são separadores impressos: não há bolha para ler.
    private static List<BubbleDefinition> markSeparatorSlots(List<BubbleDefinition> definicoes) {
        Map<GroupKey, Boolean> soSeparadores = new LinkedHashMap<>();
        for (BubbleDefinition b : definicoes) {
            if (b.kind == BubbleKind.CHOICE) continue;
            soSeparadores.merge(b.groupKey(), isSeparatorLabel(b.label), Boolean::logicalAnd);
        }
        List<BubbleDefinition> resultado = new ArrayList<>(definicoes.size());
        for (BubbleDefinition b : definicoes) {
            if (b.kind == BubbleKind.DIGIT && soSeparadores.get(b.groupKey())) {
                resultado.add(new BubbleDefinition(b.page, b.question, b.subquestion, b.choice, b.problem,
                        b.slot, b.label, BubbleKind.SEPARATOR, b.x, b.y));
            } else {
                resultado.add(b);
            }
        }
        return resultado;
    }

    public List<BubbleDefinition> bubbles() {
        return bubbles;
    }

    public Set<Integer> pages() {
        return Collections.unmodifiableSet(pages.keySet());
    }

    /** @return o layout da página, ou null se a tabela não tem bolhas para ela */
    public PageLayout forPage(int page) {
        return pages.get(page);
    }

    /** Todas as colunas "{problem}.{subquestion}" do gabarito, na ordem de saída. */
    public List<String> columns() {
        Set<String> colunas = new TreeSet<>(COLUMN_ORDER);
        for (BubbleDefinition b : bubbles) colunas.add(b.column());
        return new ArrayList<>(colunas);
    }

    static int compareColumns(String a, String b) {
        String[] pa = splitColumn(a), pb = splitColumn(b);
        int c = compareTokens(pa[0], pb[0]);
        if (c != 0) return c;
        c = compareTokens(pa[1], pb[1]);
        return c != 0 ? c : a.compareTo(b);
    }

    private static String[] splitColumn(String coluna) {
        int ponto = coluna.indexOf('.');
        return ponto < 0 ? new String[]{coluna, ""} : new String[]{coluna.substring(0, ponto), coluna.substring(ponto + 1)};
    }

    // Números antes de texto; itens em algarismos romanos (i, ii, iv...) pelo valor.
    private static int compareTokens(String a, String b) {
        Integer na = integerValue(a), nb = integerValue(b);
        if (na != null && nb != null) return Integer.compare(na, nb);
        if (na != null) return -1;
        if (nb != null) return 1;
        Integer ra = romanValue(a), rb = romanValue(b);
        if (ra != null && rb != null) return Integer.compare(ra, rb);
        return a.compareTo(b);
    }

    private static Integer integerValue(String token) {
        return token.matches("\\d{1,9}") ? Integer.valueOf(token) : null;
    }

    static Integer romanValue(String token) {
        if (token.isEmpty() || !token.matches("(?i)^x{0,3}(ix|iv|v?i{0,3})$")) {
            return null;
        }
        String s = token.toLowerCase();
        int total = 0;
        for (int i = 0; i < s.length(); i++) {
            int atual = romanDigit(s.charAt(i));
            int proximo = i + 1 < s.length() ? romanDigit(s.charAt(i + 1)) : 0;
            total += atual < proximo ? -atual : atual;
        }
        return total;
    }

    private static int romanDigit(char c) {
        switch (c) {
            case 'i': return 1;
            case 'v': return 5;
            case 'x': return 10;
            default: return 0;
        }
    }

    public static class PageLayout {
        public final int page;
        public final List<BubbleDefinition> bubbles;
        public final Map<GroupKey, List<BubbleDefinition>> groups;
        public final Map<SubquestionKey, SubquestionLayout> subquestions;

        PageLayout(int page, List<BubbleDefinition> bubbles) {
            this.page = page;
            this.bubbles = Collections.unmodifiableList(new ArrayList<>(bubbles));

            Map<GroupKey, List<BubbleDefinition>> g = new LinkedHashMap<>();
            Map<SubquestionKey, List<BubbleDefinition>> s = new LinkedHashMap<>();
            for (BubbleDefinition b : bubbles) {
                g.computeIfAbsent(b.groupKey(), k -> new ArrayList<>()).add(b);
                s.computeIfAbsent(b.subquestionKey(), k -> new ArrayList<>()).add(b);
            }
            this.groups = Collections.unmodifiableMap(g);
            Map<SubquestionKey, SubquestionLayout> sub = new LinkedHashMap<>();
            for (Map.Entry<SubquestionKey, List<BubbleDefinition>> e : s.entrySet()) {
                sub.put(e.getKey(), new SubquestionLayout(e.getKey(), e.getValue()));
            }
            this.subquestions = Collections.unmodifiableMap(sub);
        }

        /** Bolhas que de fato são amostradas (separadores impressos ficam de fora). */
        public List<BubbleDefinition> sampledBubbles() {
            List<BubbleDefinition> lista = new ArrayList<>();
            for (BubbleDefinition b : bubbles) {
                if (b.kind != BubbleKind.SEPARATOR) lista.add(b);
            }
            return lista;
        }
    }

    public static class SubquestionLayout {
        public final SubquestionKey key;
        public final List<BubbleDefinition> choices;
        public final SortedMap<Integer, List<BubbleDefinition>> slots;
        public final Set<String> catchAllLabels;

        SubquestionLayout(SubquestionKey key, List<BubbleDefinition> bubbles) {
            this.key = key;
            List<BubbleDefinition> c = new ArrayList<>();
            TreeMap<Integer, List<BubbleDefinition>> sl = new TreeMap<>();
            Set<String> outros = new LinkedHashSet<>();
            for (BubbleDefinition b : bubbles) {
                if (b.kind == BubbleKind.CHOICE) {
                    c.add(b);
                } else {
                    sl.computeIfAbsent(b.slot, k -> new ArrayList<>()).add(b);
                    // no formato "1-2-5" a coluna choice guarda a alternativa "Other" associada
                    if (!b.choice.equals(b.label)) outros.add(b.choice);
                }
            }
            if (!sl.isEmpty()) outros.add(OTHER_CHOICE);
            this.choices = Collections.unmodifiableList(c);
            for (Map.Entry<Integer, List<BubbleDefinition>> e : sl.entrySet()) {
                e.setValue(Collections.unmodifiableList(e.getValue()));
            }
            this.slots = Collections.unmodifiableSortedMap(sl);
            this.catchAllLabels = Collections.unmodifiableSet(outros);
        }

        public boolean isNumeric() {
            return !slots.isEmpty();
        }

        public boolean isSeparatorSlot(int slot) {
            List<BubbleDefinition> lista = slots.get(slot);
            return lista != null && !lista.isEmpty() && lista.get(0).kind == BubbleKind.SEPARATOR;
        }

        public boolean isCatchAll(BubbleDefinition choice) {
            return catchAllLabels.contains(choice.label);
        }
    }
}
