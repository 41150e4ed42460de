package examomr;

import org.opencv.core.Point;

import static examomr.Constants.DESIGN_UNITS_PER_INCH;

/**
 * Converte coordenadas do gabarito (pontos de 1/72 pol, origem no canto
 * inferior esquerdo) para pixels da página normalizada (origem no canto
 * superior esquerdo), e de volta.
 */
public final class CoordinateMapper {

    private final double dpi;
    private final double pageHeight;

    public CoordinateMapper(double dpi, double pageHeight) {
        if (!(dpi > 0) || !(pageHeight > 0)) {
            throw new IllegalArgumentException("Densidade e altura da página devem ser positivas");
        }
        this.dpi = dpi;
        this.pageHeight = pageHeight;
    }

    public double scale() {
        return dpi / DESIGN_UNITS_PER_INCH;
    }

    public double toPixels(double designUnits) {
        return designUnits * scale();
    }

    public Point toPixel(double xDesign, double yDesign) {
        return new Point(xDesign * scale(), (pageHeight - yDesign) * scale());
    }

    public Point toDesign(double xPixel, double yPixel) {
        return new Point(xPixel / scale(), pageHeight - yPixel / scale());
    }

    public double dpi() {
        return dpi;
    }

    public double pageHeight() {
        return pageHeight;
    }
}
