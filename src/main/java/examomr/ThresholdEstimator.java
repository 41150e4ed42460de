package examomr;

import java.util.Arrays;
import java.util.Collection;

import static examomr.DataModels.GroupKey;
import static examomr.DataModels.ThresholdDecision;

/**
 * Limiar adaptativo por grupo de bolhas mutuamente exclusivas.
 *
 * <p>O corte fica no meio do maior salto entre intensidades consecutivas
 * (ordenadas). Sem salto maior que {@code minGap}, usa a média do grupo.
 * Em qualquer caso o corte nunca passa de {@code clamp}.
 */
public class ThresholdEstimator {

    private final double minGap;
    private final double clamp;

    public ThresholdEstimator(double minGap, double clamp) {
        this.minGap = minGap;
        this.clamp = clamp;
    }

    public ThresholdEstimator(OmrConfig config) {
        this(config.minGap(), config.thresholdClamp());
    }

    public ThresholdDecision estimate(GroupKey group, Collection<Double> intensities) {
        double[] valores = new double[intensities.size()];
        int i = 0;
        for (Double v : intensities) valores[i++] = v;
        return estimate(group, valores);
    }

    public ThresholdDecision estimate(GroupKey group, double[] intensities) {
        if (intensities.length == 0) {
            return new ThresholdDecision(group, clamp, false);
        }
        double[] ordenados = intensities.clone();
        Arrays.sort(ordenados);
        int n = ordenados.length;

        double centro = (ordenados[0] + ordenados[n - 1]) / 2.0;
        double maiorSalto = 0.0;
        double corte = Double.NaN;
        for (int i = 1; i < n; i++) {
            double salto = ordenados[i] - ordenados[i - 1];
            if (salto <= minGap) continue;
            double meio = (ordenados[i] + ordenados[i - 1]) / 2.0;
            if (salto > maiorSalto) {
                maiorSalto = salto;
                corte = meio;
            } else if (salto == maiorSalto && Math.abs(meio - centro) < Math.abs(corte - centro)) {
                // empate: fica o salto mais perto do meio do grupo; persistindo, o mais baixo
                corte = meio;
            }
        }

        boolean achouSalto = !Double.isNaN(corte);
        if (!achouSalto) {
            corte = n == 1 ? clamp : mean(ordenados);
        }
        return new ThresholdDecision(group, Math.min(corte, clamp), achouSalto);
    }

    private static double mean(double[] valores) {
        double soma = 0.0;
        for (double v : valores) soma += v;
        return soma / valores.length;
    }
}
