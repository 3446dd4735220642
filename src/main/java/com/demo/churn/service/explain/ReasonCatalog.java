package com.demo.churn.service.explain;

import com.demo.churn.model.RiskLevel;
import com.demo.churn.service.dto.FeatureContribution.Direction;
import com.demo.churn.service.dto.FeatureContribution.Magnitude;

import java.text.NumberFormat;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static com.demo.churn.service.features.FeatureSchema.*;

/**
 * Fixed texts used to turn contributions into sentences: feature titles, value formats,
 * sentence templates and the (feature, direction) to action table. English by default,
 * French when the locale starts with "fr".
 */
public class ReasonCatalog {

    private static final Map<String, String[]> TITLES = new HashMap<>();
    private static final Map<String, String[]> ACTIONS = new HashMap<>();

    static {
        // {english, french}
        TITLES.put(CREDIT_SCORE, new String[]{"Credit score", "Le score de crédit"});
        TITLES.put(AGE, new String[]{"Age", "L'âge"});
        TITLES.put(TENURE, new String[]{"Tenure", "L'ancienneté"});
        TITLES.put(BALANCE, new String[]{"Account balance", "Le solde"});
        TITLES.put(PRODUCTS, new String[]{"Number of products", "Le nombre de produits"});
        TITLES.put(HAS_CARD, new String[]{"Credit card holder", "La détention d'une carte de crédit"});
        TITLES.put(ACTIVE, new String[]{"Active membership", "Le statut de membre actif"});
        TITLES.put(SALARY, new String[]{"Estimated salary", "Le salaire estimé"});
        TITLES.put(COMPLAIN, new String[]{"Recent complaint", "Une plainte récente"});
        TITLES.put(SATISFACTION, new String[]{"Satisfaction score", "Le score de satisfaction"});
        TITLES.put(POINTS, new String[]{"Loyalty points", "Les points de fidélité"});
        TITLES.put(MALE, new String[]{"Gender (male)", "Le sexe (homme)"});
        TITLES.put(GERMANY, new String[]{"Country: Germany", "Le pays (Allemagne)"});
        TITLES.put(SPAIN, new String[]{"Country: Spain", "Le pays (Espagne)"});
        TITLES.put(GOLD, new String[]{"Tier: GOLD", "La catégorie GOLD"});
        TITLES.put(PLATINUM, new String[]{"Tier: PLATINUM", "La catégorie PLATINUM"});
        TITLES.put(SILVER, new String[]{"Tier: SILVER", "La catégorie SILVER"});

        action(SATISFACTION, Direction.INCREASES, "Run an urgent satisfaction survey", "Enquête de satisfaction urgente recommandée");
        action(AGE, Direction.INCREASES, "Offer products suited to the customer's life stage", "Proposer des produits adaptés au profil d'âge du client");
        action(PRODUCTS, Direction.INCREASES, "Cross-sell to diversify the customer's portfolio", "Stratégie de cross-selling pour diversifier le portefeuille");
        action(BALANCE, Direction.INCREASES, "Offer savings and money management support", "Accompagnement en épargne et gestion financière");
        action(COMPLAIN, Direction.INCREASES, "Resolve the open complaint with a dedicated advisor", "Traiter la plainte en cours avec un conseiller dédié");
        action(ACTIVE, Direction.INCREASES, "Start a re-engagement campaign", "Lancer une campagne de réactivation");
        action(CREDIT_SCORE, Direction.INCREASES, "Offer personalised financial guidance", "Accompagnement financier personnalisé");
        action(TENURE, Direction.INCREASES, "Enrol the customer in the loyalty programme", "Inscrire le client au programme de fidélité");
        action(POINTS, Direction.INCREASES, "Promote redemption of loyalty points", "Valoriser l'utilisation des points de fidélité");
        action(SALARY, Direction.INCREASES, "Propose premium products", "Proposition produits premium");
        action(GERMANY, Direction.INCREASES, "Apply the local-market retention offer", "Appliquer l'offre de rétention du marché local");
        action(GOLD, Direction.INCREASES, "Review tier benefits with the customer", "Revoir les avantages de la catégorie avec le client");
        action(PLATINUM, Direction.INCREASES, "Review tier benefits with the customer", "Revoir les avantages de la catégorie avec le client");
        action(SILVER, Direction.INCREASES, "Review tier benefits with the customer", "Revoir les avantages de la catégorie avec le client");
        action(ACTIVE, Direction.DECREASES, "Keep rewarding the customer's activity", "Continuer à récompenser l'activité du client");
    }

    private static final String[] STABLE = {
            "Relatively stable profile, maintain the current relationship",
            "Profil relativement stable, maintenir la relation actuelle"};

    private static void action(String feature, Direction dir, String en, String fr) {
        ACTIONS.put(key(feature, dir), new String[]{en, fr});
    }

    private static String key(String feature, Direction dir) {
        return feature + "|" + dir.name();
    }

    public static Locale resolve(String locale) {
        return (locale != null && locale.toLowerCase(Locale.ROOT).startsWith("fr")) ? Locale.FRENCH : Locale.ENGLISH;
    }

    private static int lang(Locale lc) {
        return Locale.FRENCH.getLanguage().equals(lc.getLanguage()) ? 1 : 0;
    }

    public String title(Locale lc, String feature) {
        String[] t = TITLES.get(feature);
        if (t != null) return t[lang(lc)];
        return (lang(lc) == 1 ? "Facteur : " : "Feature: ") + feature;
    }

    /** Recommended action for a pair, or null when the table has none. */
    public String action(Locale lc, String feature, Direction dir) {
        String[] a = ACTIONS.get(key(feature, dir));
        return a == null ? null : a[lang(lc)];
    }

    public String stableProfileAction(Locale lc) {
        return STABLE[lang(lc)];
    }

    public String formatValue(Locale lc, String feature, double v) {
        boolean fr = lang(lc) == 1;
        switch (feature) {
            case AGE:
            case TENURE:
                return fmtInt(v) + (fr ? " ans" : " years");
            case SATISFACTION:
                return fmtInt(v) + "/5";
            case BALANCE:
            case SALARY: {
                NumberFormat nf = NumberFormat.getIntegerInstance(fr ? Locale.FRANCE : Locale.UK);
                return nf.format(Math.round(v)) + " €";
            }
            case HAS_CARD:
            case ACTIVE:
            case COMPLAIN:
            case MALE:
            case GERMANY:
            case SPAIN:
            case GOLD:
            case PLATINUM:
            case SILVER:
                return v >= 0.5 ? (fr ? "oui" : "yes") : (fr ? "non" : "no");
            default:
                return fmtInt(v);
        }
    }

    /** One sentence per factor, e.g. "Age (52 years) strongly increases churn risk (+0.142)." */
    public String factorText(Locale lc, String feature, double value, double contribution,
                             Direction dir, Magnitude magnitude) {
        String title = title(lc, feature);
        String v = formatValue(lc, feature, value);
        String contrib = String.format(Locale.ROOT, "%+.3f", contribution);
        if (dir == Direction.NEUTRAL) {
            return lang(lc) == 1
                    ? title + " (" + v + ") ne modifie pas le risque de churn (" + contrib + ")."
                    : title + " (" + v + ") does not change churn risk (" + contrib + ").";
        }
        if (lang(lc) == 1) {
            String adverb = magnitude == Magnitude.MAJOR ? "fortement" : magnitude == Magnitude.MODERATE ? "modérément" : "légèrement";
            String impact = dir == Direction.INCREASES ? "augmente" : "diminue";
            return title + " (" + v + ") " + adverb + " " + impact + " le risque de churn (" + contrib + ").";
        }
        String adverb = magnitude == Magnitude.MAJOR ? "strongly" : magnitude == Magnitude.MODERATE ? "moderately" : "slightly";
        String impact = dir == Direction.INCREASES ? "increases" : "decreases";
        return title + " (" + v + ") " + adverb + " " + impact + " churn risk (" + contrib + ").";
    }

    public String headline(Locale lc, double probability, RiskLevel risk, double baseline, boolean approximate) {
        String p = String.format(Locale.ROOT, "%.1f%%", probability * 100);
        String b = String.format(Locale.ROOT, "%.1f%%", baseline * 100);
        if (lang(lc) == 1) {
            String level = risk == RiskLevel.HIGH ? "élevé" : risk == RiskLevel.MEDIUM ? "moyen" : "faible";
            return "Probabilité de churn " + p + " (risque " + level + ") contre " + b + " en moyenne."
                    + (approximate ? " Explication approximative (importance globale du modèle)." : "");
        }
        String level = risk.name().toLowerCase(Locale.ROOT);
        return "Churn probability " + p + " (" + level + " risk) against an average of " + b + "."
                + (approximate ? " Approximate explanation (global model importance)." : "");
    }

    private static String fmtInt(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.format(Locale.ROOT, "%.2f", v);
    }
}
