package examomr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static examomr.BubbleLayout.PageLayout;
import static examomr.BubbleLayout.SubquestionLayout;
import static examomr.Constants.DECIMAL_LABEL;
import static examomr.Constants.SLASH_LABEL;
import static examomr.DataModels.*;

/**
 * Transforma as decisões marcada/em branco de cada bolha em respostas:
 * alternativa única, número montado posição a posição, ou ambígua.
 */
public class AnswerDecoder {

    /** Resultado de um grupo de alternativas exclusivas. */
    public static class Choice {
        public static final Choice BLANK = new Choice(null, false);
        public static final Choice AMBIGUOUS = new Choice(null, true);

        public final String label;
        public final boolean ambiguous;

        private Choice(String label, boolean ambiguous) {
            this.label = label;
            this.ambiguous = ambiguous;
        }

        public static Choice of(String label) {
            return new Choice(label, false);
        }

        public boolean isBlank() {
            return label == null && !ambiguous;
        }
    }

    public Choice decodeSingleChoice(List<BubbleDefinition> marcadas) {
        if (marcadas.isEmpty()) return Choice.BLANK;
        if (marcadas.size() > 1) return Choice.AMBIGUOUS;
        return Choice.of(marcadas.get(0).label);
    }

    /**
     * Concatena as posições decodificadas na ordem; D vira ponto decimal e S vira barra.
     * Posições em branco (null) são puladas.
     */
    public String assembleNumeric(List<String> posicoes) {
        StringBuilder sb = new StringBuilder();
        for (String p : posicoes) {
            if (p == null) continue;
            sb.append(literal(p));
        }
        return sb.toString();
    }

    private static String literal(String label) {
        if (DECIMAL_LABEL.equals(label)) return ".";
        if (SLASH_LABEL.equals(label)) return "/";
        return label;
    }

    private static boolean isDigit(String label) {
        return label.length() == 1 && Character.isDigit(label.charAt(0));
    }

    public List<DecodedAnswer> decodePage(String studentId, PageLayout layout,
                                          Map<BubbleDefinition, Double> intensidades,
                                          Map<GroupKey, ThresholdDecision> limiares) {
        List<DecodedAnswer> respostas = new ArrayList<>();
        for (SubquestionLayout sub : layout.subquestions.values()) {
            respostas.add(decodeSubquestion(studentId, sub, intensidades, limiares));
        }
        return respostas;
    }

    public DecodedAnswer decodeSubquestion(String studentId, SubquestionLayout sub,
                                           Map<BubbleDefinition, Double> intensidades,
                                           Map<GroupKey, ThresholdDecision> limiares) {
        List<BubbleDefinition> marcadas = filled(sub.choices, intensidades, limiares);
        String problema = sub.key.problem, item = sub.key.subquestion;

        if (!sub.isNumeric()) {
            Choice c = decodeSingleChoice(marcadas);
            return new DecodedAnswer(studentId, problema, item, c.label, c.ambiguous);
        }

        List<String> posicoes = new ArrayList<>();
        boolean temDigito = false;
        boolean posicaoAmbigua = false;
        for (Map.Entry<Integer, List<BubbleDefinition>> slot : sub.slots.entrySet()) {
            if (sub.isSeparatorSlot(slot.getKey())) {
                posicoes.add(slot.getValue().get(0).label);
                continue;
            }
            Choice c = decodeSingleChoice(filled(slot.getValue(), intensidades, limiares));
            if (c.ambiguous) posicaoAmbigua = true;
            if (c.label != null && isDigit(c.label)) temDigito = true;
            posicoes.add(c.label);
        }

        // havendo número, a alternativa "Other" é descartada
        if (temDigito || posicaoAmbigua) {
            List<BubbleDefinition> semOutros = new ArrayList<>();
            for (BubbleDefinition b : marcadas) {
                if (!sub.isCatchAll(b)) semOutros.add(b);
            }
            marcadas = semOutros;
        }

        if (posicaoAmbigua) {
            return new DecodedAnswer(studentId, problema, item, null, true);
        }
        if (temDigito) {
            if (!marcadas.isEmpty()) {
                return new DecodedAnswer(studentId, problema, item, null, true);
            }
            return new DecodedAnswer(studentId, problema, item, assembleNumeric(posicoes), false);
        }
        Choice c = decodeSingleChoice(marcadas);
        return new DecodedAnswer(studentId, problema, item, c.label, c.ambiguous);
    }

    private static List<BubbleDefinition> filled(List<BubbleDefinition> grupo,
                                                 Map<BubbleDefinition, Double> intensidades,
                                                 Map<GroupKey, ThresholdDecision> limiares) {
        List<BubbleDefinition> marcadas = new ArrayList<>();
        for (BubbleDefinition b : grupo) {
            Double v = intensidades.get(b);
            ThresholdDecision d = limiares.get(b.groupKey());
            if (v != null && d != null && d.isFilled(v)) marcadas.add(b);
        }
        return marcadas;
    }
}
