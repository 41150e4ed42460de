package examomr;

import org.opencv.core.Scalar;

public class Constants {

    // --- Sistema de coordenadas do gabarito (pontos = 1/72 polegada, origem inferior esquerda) ---
    public static final double DESIGN_UNITS_PER_INCH = 72.0;
    public static final double PAGE_WIDTH_PT = 612.0;   // Carta: 8.5 pol
    public static final double PAGE_HEIGHT_PT = 792.0;  // Carta: 11 pol
    public static final double CANONICAL_DPI = 200.0;

    // --- Parâmetros dos marcadores de alinhamento ---
    public static final double MARKER_CONFIDENCE_GATE = 0.6;
    public static final double MARKER_RADIUS_PT = 10.0;
    public static final double MARKER_DISTANCE_PT = 30.0;
    public static final double CORNER_SEARCH_FRACTION = 0.25;
    public static final int PREPROCESS_BLUR_SIZE = 3;

    // --- Parâmetros de leitura de bolha (OMR) ---
    public static final double BUBBLE_RADIUS_PT = 7.0;
    public static final double THRESHOLD_CLAMP = 210.0;
    public static final double MIN_GAP = 25.0;

    // --- Vocabulário do gabarito ---
    public static final String OTHER_CHOICE = "Other";
    public static final String DECIMAL_LABEL = "D";
    public static final String SLASH_LABEL = "S";
    public static final String REPLACEMENT_SUFFIX = "replacement";

    // --- Arquivos de saída ---
    public static final String OUTPUT_DIR_SUFFIX = "_OMR";
    public static final String OUTPUT_CONSOLIDATED = "consolidated_answers.csv";
    public static final String OUTPUT_FAILURES = "failures.csv";
    public static final String OUTPUT_PAGE_DIR_PREFIX = "page_";
    public static final String OUTPUT_PAGE_CSV_SUFFIX = "_OMR.csv";
    public static final String OUTPUT_OVERLAY_EXT = ".png";
    public static final String OUTPUT_PREVIEW_PREFIX = "layout_page_";

    // --- Cores do overlay (BGR) ---
    public static final Scalar COLOR_FILLED = new Scalar(0, 0, 255);
    public static final Scalar COLOR_BLANK = new Scalar(130, 130, 130);
    public static final Scalar COLOR_SEPARATOR = new Scalar(0, 255, 0);
    public static final Scalar COLOR_MARKER = new Scalar(255, 0, 0);
    public static final Scalar COLOR_PAGE_FILL = new Scalar(255, 255, 255);
}
