package com.scoutmind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Structured product information extracted from a product page.
 *
 * @param url          page the data was extracted from
 * @param title        product name
 * @param price        price as displayed, e.g. "$199.99"
 * @param rating       average customer rating on a 0-5 scale
 * @param reviewCount  number of customer reviews
 * @param features     key feature bullets
 * @param description  product description
 * @param availability stock status text
 * @param brand        manufacturer or brand
 * @param category     product category
 * @param images       image URLs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductData(
    String url,
    String title,
    String price,
    Double rating,
    @JsonProperty("review_count") Integer reviewCount,
    List<String> features,
    String description,
    String availability,
    String brand,
    String category,
    List<String> images
) implements Serializable {

    public static final String UNKNOWN_TITLE = "Unknown Product";

    private static final List<String> FAILED_TITLE_MARKERS =
            List.of("access denied", "captcha", "error", "blocked", "unknown product");

    public ProductData {
        features = features == null ? List.of() : features.stream().filter(Objects::nonNull).toList();
        images = images == null ? List.of() : images.stream().filter(Objects::nonNull).toList();
        if (rating != null && (rating < 0 || rating > 5)) {
            rating = null;
        }
    }

    public ProductData withUrl(String newUrl) {
        return new ProductData(newUrl, title, price, rating, reviewCount, features,
                description, availability, brand, category, images);
    }

    /**
     * Fills any field that is missing here from {@code other}. Values already
     * present are kept.
     */
    public ProductData augmentFrom(ProductData other) {
        if (other == null) {
            return this;
        }
        return new ProductData(
                url != null ? url : other.url,
                isBlank(title) ? other.title : title,
                isBlank(price) ? other.price : price,
                rating != null ? rating : other.rating,
                reviewCount != null ? reviewCount : other.reviewCount,
                features.isEmpty() ? other.features : features,
                isBlank(description) ? other.description : description,
                isBlank(availability) ? other.availability : availability,
                isBlank(brand) ? other.brand : brand,
                isBlank(category) ? other.category : category,
                images.isEmpty() ? other.images : images);
    }

    /**
     * True when the title looks like real product data rather than a blocked
     * page, captcha wall or extraction placeholder.
     */
    public boolean looksValid() {
        if (isBlank(title)) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return FAILED_TITLE_MARKERS.stream().noneMatch(lower::contains);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
