package examomr;

import java.util.Objects;

/**
 * Decide o que acontece quando uma resposta chega para uma célula
 * (aluno, "{problem}.{subquestion}") da tabela consolidada.
 */
public interface MergePolicy {

    enum Action {
        /** Grava o valor recebido. */
        WRITE,
        /** Mantém a célula como está. */
        KEEP,
        /** Conflito: nenhum dos valores fica na célula. */
        CONFLICT
    }

    /**
     * @param occupied    a célula já recebeu alguma página (gravada ou em conflito)
     * @param conflicted  a célula já está em conflito
     * @param existing    valor atual (null = em branco ou em conflito)
     * @param incoming    valor recebido (null = em branco)
     * @param replacement a página recebida é substituta
     */
    Action decide(boolean occupied, boolean conflicted, String existing, String incoming, boolean replacement);

    /**
     * Página substituta sempre sobrescreve; duplicata comum só é aceita se
     * trouxer o mesmo valor, senão vira conflito.
     */
    MergePolicy REPLACEMENT_OR_CONFLICT = (occupied, conflicted, existing, incoming, replacement) -> {
        if (replacement || !occupied) return Action.WRITE;
        if (conflicted) return Action.CONFLICT;
        return Objects.equals(existing, incoming) ? Action.KEEP : Action.CONFLICT;
    };
}
