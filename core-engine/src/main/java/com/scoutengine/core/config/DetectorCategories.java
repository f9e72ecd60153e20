package com.scoutengine.core.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * The set of business areas whose rules are enabled for a run.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_ENABLED_CATEGORIES}, a comma-separated
 * list of areas</li>
 * <li>The preset for the product type, if one is known</li>
 * <li>All of {@link #DEFAULT_AREAS}</li>
 * </ol>
 *
 * <p>
 * Rules that declare no area are always enabled.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorCategories {

    public static final String ENV_ENABLED_CATEGORIES = "ENABLED_DETECTOR_CATEGORIES";

    public static final List<String> DEFAULT_AREAS =
            List.of("email", "revenue", "pages", "traffic", "seo", "advertising", "content");

    private static final Map<String, List<String>> PRODUCT_PRESETS = Map.of(
            "saas", DEFAULT_AREAS,
            "ecommerce", List.of("email", "revenue", "pages", "traffic", "seo", "advertising"),
            "content", List.of("seo", "content", "pages", "traffic"),
            "b2b", List.of("email", "revenue", "pages", "traffic", "advertising"));

    private static final DetectorCategories ALL = new DetectorCategories(new LinkedHashSet<>(DEFAULT_AREAS));

    private final Set<String> areas;

    private DetectorCategories(Set<String> areas) {
        this.areas = Collections.unmodifiableSet(areas);
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static DetectorCategories all() {
        return ALL;
    }

    /**
     * @param areas business areas; blank entries are ignored, case is
     *              normalised
     * @throws IllegalArgumentException if no area remains
     */
    public static DetectorCategories of(Collection<String> areas) {
        Objects.requireNonNull(areas, "areas must not be null");
        Set<String> normalised = new LinkedHashSet<>();
        for (String area : areas) {
            if (area != null && !area.isBlank()) {
                normalised.add(area.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (normalised.isEmpty()) {
            throw new IllegalArgumentException("At least one detector category must be enabled");
        }
        return new DetectorCategories(normalised);
    }

    /**
     * Preset for a product type ({@code saas}, {@code ecommerce},
     * {@code content}, {@code b2b}). Unknown or {@code null} product types get
     * all areas.
     */
    public static DetectorCategories forProduct(String productType) {
        if (productType == null || productType.isBlank()) {
            return ALL;
        }
        List<String> preset = PRODUCT_PRESETS.get(productType.trim().toLowerCase(Locale.ROOT));
        return preset != null ? of(preset) : ALL;
    }

    /**
     * Resolve from {@value #ENV_ENABLED_CATEGORIES}, falling back to the
     * product preset.
     *
     * @param env         environment lookup, e.g. {@code System::getenv}
     * @param productType optional product type
     */
    public static DetectorCategories resolve(Function<String, String> env, String productType) {
        Objects.requireNonNull(env, "env must not be null");
        String override = env.apply(ENV_ENABLED_CATEGORIES);
        if (override != null && !override.isBlank()) {
            return of(Arrays.asList(override.split(",")));
        }
        return forProduct(productType);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return {@code true} if rules in {@code area} should run; always
     *         {@code true} for a {@code null} area
     */
    public boolean isEnabled(String area) {
        return area == null || areas.contains(area.toLowerCase(Locale.ROOT));
    }

    public Set<String> getAreas() {
        return areas;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorCategories that))
            return false;
        return areas.equals(that.areas);
    }

    @Override
    public int hashCode() {
        return areas.hashCode();
    }

    @Override
    public String toString() {
        return "DetectorCategories" + areas;
    }
}
