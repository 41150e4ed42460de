package examomr;

import examomr.DataModels.FailureReason;

/**
 * Falha restrita a uma página. É capturada na fronteira do worker e vira um
 * {@link DataModels.PageFailure}; nunca interrompe o lote.
 */
public class PageFailureException extends Exception {

    private final FailureReason reason;

    public PageFailureException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
