package com.scoutmind.core.search;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes retailer product-detail URLs among search results.
 */
public final class ProductUrlMatcher {

    private static final List<Pattern> PRODUCT_PAGE_PATTERNS = List.of(
            Pattern.compile("amazon\\.com/.*/?(dp|gp/product)/"),
            Pattern.compile("bestbuy\\.com/site/"),
            Pattern.compile("walmart\\.com/ip/"),
            Pattern.compile("target\\.com/p/"),
            Pattern.compile("ebay\\.com/itm/")
    );

    private ProductUrlMatcher() {}

    public static boolean isProductUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        return PRODUCT_PAGE_PATTERNS.stream().anyMatch(p -> p.matcher(url).find());
    }

    public static List<String> productUrls(List<String> urls) {
        return urls.stream().filter(ProductUrlMatcher::isProductUrl).toList();
    }
}
