package examomr;

import examomr.DataModels.FailureReason;

/** A página não tem bolhas no gabarito, ou as bolhas do gabarito caem fora da imagem. */
public class LayoutMismatchException extends PageFailureException {

    public LayoutMismatchException(String message) {
        super(FailureReason.MISSING_LAYOUT_ENTRY, message);
    }
}
