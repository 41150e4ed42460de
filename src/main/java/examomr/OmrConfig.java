package examomr;

import static examomr.Constants.*;

/**
 * Parâmetros de uma execução do OMR. Imutável: cada pipeline recebe a sua
 * instância, então duas configurações diferentes podem rodar ao mesmo tempo.
 */
public final class OmrConfig {

    private final double markerConfidenceGate;
    private final double thresholdClamp;
    private final double minGap;
    private final double bubbleRadius;
    private final double markerRadius;
    private final double markerDistance;
    private final double pageWidth;
    private final double pageHeight;
    private final double dpi;
    private final double cornerSearchFraction;
    private final int workers;
    private final boolean writeOverlays;
    private final boolean quiet;

    private OmrConfig(Builder b) {
        if (b.markerConfidenceGate < 0.0 || b.markerConfidenceGate > 1.0) {
            throw new IllegalArgumentException("Confiança mínima do marcador fora de [0,1]: " + b.markerConfidenceGate);
        }
        if (b.thresholdClamp <= 0.0 || b.thresholdClamp > 255.0) {
            throw new IllegalArgumentException("Limite máximo do limiar fora de (0,255]: " + b.thresholdClamp);
        }
        if (b.minGap < 0.0) {
            throw new IllegalArgumentException("Salto mínimo negativo: " + b.minGap);
        }
        requirePositive("bubbleRadius", b.bubbleRadius);
        requirePositive("markerRadius", b.markerRadius);
        requirePositive("markerDistance", b.markerDistance);
        requirePositive("pageWidth", b.pageWidth);
        requirePositive("pageHeight", b.pageHeight);
        requirePositive("dpi", b.dpi);
        requirePositive("workers", b.workers);
        if (b.cornerSearchFraction <= 0.0 || b.cornerSearchFraction > 0.5) {
            throw new IllegalArgumentException("Fração de busca de canto fora de (0, 0.5]: " + b.cornerSearchFraction);
        }
        this.markerConfidenceGate = b.markerConfidenceGate;
        this.thresholdClamp = b.thresholdClamp;
        this.minGap = b.minGap;
        this.bubbleRadius = b.bubbleRadius;
        this.markerRadius = b.markerRadius;
        this.markerDistance = b.markerDistance;
        this.pageWidth = b.pageWidth;
        this.pageHeight = b.pageHeight;
        this.dpi = b.dpi;
        this.cornerSearchFraction = b.cornerSearchFraction;
        this.workers = b.workers;
        this.writeOverlays = b.writeOverlays;
        this.quiet = b.quiet;
    }

    private static void requirePositive(String nome, double valor) {
        if (!(valor > 0.0)) {
            throw new IllegalArgumentException(nome + " deve ser positivo: " + valor);
        }
    }

    public static OmrConfig defaults() {
        return builder().build();
    }

    /**
     * Lê as chaves {@code omr.*} das propriedades do sistema, usando os valores
     * de {@link Constants} quando ausentes.
     */
    public static OmrConfig fromSystemProperties() {
        Builder b = builder();
        b.markerConfidenceGate(doubleProperty("omr.marker.gate", MARKER_CONFIDENCE_GATE));
        b.thresholdClamp(doubleProperty("omr.threshold.clamp", THRESHOLD_CLAMP));
        b.minGap(doubleProperty("omr.threshold.minGap", MIN_GAP));
        b.bubbleRadius(doubleProperty("omr.bubble.radius", BUBBLE_RADIUS_PT));
        b.markerRadius(doubleProperty("omr.marker.radius", MARKER_RADIUS_PT));
        b.markerDistance(doubleProperty("omr.marker.distance", MARKER_DISTANCE_PT));
        b.pageSize(doubleProperty("omr.page.width", PAGE_WIDTH_PT), doubleProperty("omr.page.height", PAGE_HEIGHT_PT));
        b.dpi(doubleProperty("omr.dpi", CANONICAL_DPI));
        b.cornerSearchFraction(doubleProperty("omr.marker.searchFraction", CORNER_SEARCH_FRACTION));
        b.workers(Integer.parseInt(System.getProperty("omr.workers",
                String.valueOf(Runtime.getRuntime().availableProcessors()))));
        b.writeOverlays(Boolean.parseBoolean(System.getProperty("omr.overlay", "false")));
        b.quiet(Boolean.parseBoolean(System.getProperty("omr.quiet", "false")));
        return b.build();
    }

    private static double doubleProperty(String key, double padrao) {
        String valor = System.getProperty(key);
        if (valor == null || valor.isBlank()) return padrao;
        try {
            return Double.parseDouble(valor.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valor inválido para " + key + ": '" + valor + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .markerConfidenceGate(markerConfidenceGate)
                .thresholdClamp(thresholdClamp)
                .minGap(minGap)
                .bubbleRadius(bubbleRadius)
                .markerRadius(markerRadius)
                .markerDistance(markerDistance)
                .pageSize(pageWidth, pageHeight)
                .dpi(dpi)
                .cornerSearchFraction(cornerSearchFraction)
                .workers(workers)
                .writeOverlays(writeOverlays)
                .quiet(quiet);
    }

    public double markerConfidenceGate() { return markerConfidenceGate; }
    public double thresholdClamp() { return thresholdClamp; }
    public double minGap() { return minGap; }
    public double bubbleRadius() { return bubbleRadius; }
    public double markerRadius() { return markerRadius; }
    public double markerDistance() { return markerDistance; }
    public double pageWidth() { return pageWidth; }
    public double pageHeight() { return pageHeight; }
    public double dpi() { return dpi; }
    public double cornerSearchFraction() { return cornerSearchFraction; }
    public int workers() { return workers; }
    public boolean writeOverlays() { return writeOverlays; }
    public boolean quiet() { return quiet; }

    public CoordinateMapper coordinateMapper() {
        return new CoordinateMapper(dpi, pageHeight);
    }

    public int canonicalWidthPx() {
        return (int) Math.round(pageWidth * dpi / DESIGN_UNITS_PER_INCH);
    }

    public int canonicalHeightPx() {
        return (int) Math.round(pageHeight * dpi / DESIGN_UNITS_PER_INCH);
    }

    @Override
    public String toString() {
        return "OmrConfig{gate=" + markerConfidenceGate + ", clamp=" + thresholdClamp + ", minGap=" + minGap
                + ", dpi=" + dpi + ", page=" + pageWidth + "x" + pageHeight + ", workers=" + workers
                + ", overlays=" + writeOverlays + "}";
    }

    public static final class Builder {
        private double markerConfidenceGate = MARKER_CONFIDENCE_GATE;
        private double thresholdClamp = THRESHOLD_CLAMP;
        private double minGap = MIN_GAP;
        private double bubbleRadius = BUBBLE_RADIUS_PT;
        private double markerRadius = MARKER_RADIUS_PT;
        private double markerDistance = MARKER_DISTANCE_PT;
        private double pageWidth = PAGE_WIDTH_PT;
        private double pageHeight = PAGE_HEIGHT_PT;
        private double dpi = CANONICAL_DPI;
        private double cornerSearchFraction = CORNER_SEARCH_FRACTION;
        private int workers = Runtime.getRuntime().availableProcessors();
        private boolean writeOverlays = false;
        private boolean quiet = false;

        private Builder() {
        }

        public Builder markerConfidenceGate(double v) { this.markerConfidenceGate = v; return this; }
        public Builder thresholdClamp(double v) { this.thresholdClamp = v; return this; }
        public Builder minGap(double v) { this.minGap = v; return this; }
        public Builder bubbleRadius(double v) { this.bubbleRadius = v; return this; }
        public Builder markerRadius(double v) { this.markerRadius = v; return this; }
        public Builder markerDistance(double v) { this.markerDistance = v; return this; }
        public Builder pageSize(double largura, double altura) { this.pageWidth = largura; this.pageHeight = altura; return this; }
        public Builder dpi(double v) { this.dpi = v; return this; }
        public Builder cornerSearchFraction(double v) { this.cornerSearchFraction = v; return this; }
        public Builder workers(int v) { this.workers = v; return this; }
        public Builder writeOverlays(boolean v) { this.writeOverlays = v; return this; }
        public Builder quiet(boolean v) { this.quiet = v; return this; }

        public OmrConfig build() {
            return new OmrConfig(this);
        }
    }
}
