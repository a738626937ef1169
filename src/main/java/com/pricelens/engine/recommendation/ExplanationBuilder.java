package com.pricelens.engine.recommendation;

import com.pricelens.engine.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Builds the one-paragraph explanation shown next to a recommendation.
 *
 * <p>The text is picked from a fixed table:
 * <pre>
 *   UP   / floor applied -> "... below your margin floor of X, so the price is raised to the floor ..."
 *   DOWN / floor applied -> "... so the price is lowered only as far as the floor ..."
 *   SAME / floor applied -> "... so your price stays at the floor ..."
 *   UP   / not applied   -> "Competitor prices are higher than yours."
 *   DOWN / not applied   -> "Competitor prices are lower than yours."
 *   SAME / not applied   -> "Your price is aligned with competitors."
 * </pre>
 * followed by a basis sentence (one competitor or the average of n) and, for two or more
 * competitors whose spread exceeds {@code app.pricing.wide-spread-fraction}, a hint to review
 * the matched listings. Singular wording is used for a single competitor.
 */
@Component
public class ExplanationBuilder {
    private final AppProperties appProperties;

    public ExplanationBuilder(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    public String build(PriceDecision decision, int competitorCount) {
        boolean single = competitorCount == 1;
        StringBuilder sb = new StringBuilder();

        if (decision.marginFloorApplied()) {
            sb.append(single ? "The competitor price is" : "Competitor prices are")
              .append(" below your margin floor of ").append(money(decision.marginFloor()))
              .append(switch (decision.direction()) {
                  case UP -> ", so the price is raised to the floor";
                  case DOWN -> ", so the price is lowered only as far as the floor";
                  case SAME -> ", so your price stays at the floor";
              })
              .append(" to keep at least ")
              .append(percent(appProperties.getPricing().getMinMarginFraction() * 100)).append("% margin.");
        } else {
            switch (decision.direction()) {
                case UP -> sb.append(single ? "The competitor price is higher than yours." : "Competitor prices are higher than yours.");
                case DOWN -> sb.append(single ? "The competitor price is lower than yours." : "Competitor prices are lower than yours.");
                case SAME -> sb.append(single ? "Your price is aligned with the competitor." : "Your price is aligned with competitors.");
            }
        }

        if (single) {
            sb.append(" Based on 1 competitor priced at ").append(money(decision.competitorAvg())).append('.');
        } else {
            sb.append(" Based on ").append(competitorCount).append(" competitors averaging ")
              .append(money(decision.competitorAvg())).append('.');
            if (decision.spread() > appProperties.getPricing().getWideSpreadFraction()) {
                sb.append(" Prices vary widely (").append(money(decision.minCompetitorPrice()))
                  .append(" to ").append(money(decision.maxCompetitorPrice()))
                  .append("); review the matched listings.");
            }
        }
        return sb.toString();
    }

    private static String money(Double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private static String percent(double v) {
        double r = Math.round(v * 10) / 10.0;
        if (r == Math.rint(r)) return String.valueOf((long) r);
        return String.format(Locale.ROOT, "%.1f", r);
    }
}
