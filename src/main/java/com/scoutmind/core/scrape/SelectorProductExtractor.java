package com.scoutmind.core.scrape;

import com.scoutmind.core.model.ProductData;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CSS-selector extraction for product pages. Used to fill fields the LLM
 * extraction missed and as the whole extraction when the LLM is unavailable.
 * Amazon and Best Buy get dedicated selector sets; everything else goes through
 * a generic set.
 */
@Component
public class SelectorProductExtractor {

    private static final int MAX_FEATURES = 5;
    private static final int MAX_DESCRIPTION_CHARS = 500;

    public ProductData extract(Document doc, String url) {
        String host = url == null ? "" : url.toLowerCase(Locale.ROOT);
        if (host.contains("amazon.com")) {
            return extractAmazon(doc, url);
        }
        if (host.contains("bestbuy.com")) {
            return extractBestBuy(doc, url);
        }
        return extractGeneric(doc, url);
    }

    ProductData extractAmazon(Document doc, String url) {
        String title = text(doc.selectFirst("#productTitle, h1.product-title"));
        String price = text(doc.selectFirst(".a-price .a-offscreen, .a-price-whole"));

        Element ratingElem = doc.selectFirst(
                "#acrPopover, .a-icon-star .a-icon-alt, [data-hook=\"rating-out-of-text\"], a.a-popover-trigger span");
        Double rating = null;
        if (ratingElem != null) {
            String ratingText = ratingElem.hasAttr("title") ? ratingElem.attr("title") : ratingElem.text();
            rating = TextExtractors.rating(ratingText)
                    .or(() -> TextExtractors.leadingRating(ratingText))
                    .orElse(null);
        }

        Element reviewElem = doc.selectFirst(
                "#acrCustomerReviewText, [data-hook=\"total-review-count\"], #acrCustomerReviewLink span");
        Integer reviewCount = reviewElem == null ? null : TextExtractors.count(reviewElem.text()).orElse(null);

        List<String> features = new ArrayList<>();
        for (Element bullet : doc.select("#feature-bullets li, .a-unordered-list.a-vertical li")) {
            String text = bullet.text().trim();
            if (!text.isEmpty()) {
                features.add(text);
            }
            if (features.size() == MAX_FEATURES) {
                break;
            }
        }

        String description = text(doc.selectFirst("#productDescription, #feature-bullets"));
        if (description != null && description.length() > MAX_DESCRIPTION_CHARS) {
            description = description.substring(0, MAX_DESCRIPTION_CHARS);
        }

        String availability = text(doc.selectFirst("#availability"));
        return new ProductData(url, title, price, rating, reviewCount, features, description,
                availability != null ? availability : "In Stock", null, null, List.of());
    }

    ProductData extractBestBuy(Document doc, String url) {
        String title = text(doc.selectFirst(".sku-title, h1"));
        String price = text(doc.selectFirst(".priceView-customer-price span, .priceView-hero-price span"));
        return new ProductData(url, title, price, null, null, List.of(), null, null, null, null, List.of());
    }

    ProductData extractGeneric(Document doc, String url) {
        String title = text(doc.selectFirst("h1, .product-title, .product-name"));
        Element priceElem = doc.selectFirst(".price, .product-price, [itemprop=\"price\"]");
        String price = null;
        if (priceElem != null) {
            price = priceElem.hasAttr("content") && priceElem.text().isBlank()
                    ? priceElem.attr("content")
                    : priceElem.text().trim();
        }
        return new ProductData(url, title != null ? title : ProductData.UNKNOWN_TITLE, price,
                null, null, List.of(), null, null, null, null, List.of());
    }

    private static String text(Element element) {
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }
}
