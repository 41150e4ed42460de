package examomr;

import examomr.DataModels.FailureReason;

/** Menos de quatro marcadores encontrados, ou algum abaixo da confiança mínima. */
public class AlignmentException extends PageFailureException {

    public AlignmentException(String message) {
        super(FailureReason.ALIGNMENT_FAILED, message);
    }
}
