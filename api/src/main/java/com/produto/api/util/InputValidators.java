package com.produto.api.util;

import com.produto.api.exception.BadRequestException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Sanitizes free-text query input and checks paging parameters.
 * All failures surface as {@link BadRequestException}.
 */
@Slf4j
public final class InputValidators {

    public static final int MAX_SEARCH_TERM_LENGTH = 100;
    public static final int MIN_SEARCH_TERM_LENGTH = 2;
    public static final int MAX_CATEGORY_LENGTH = 50;
    public static final int MAX_PAGE_SIZE = 100;
    public static final int MAX_PAGE_NUMBER = 10_000;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final List<String> DANGEROUS_TOKENS = List.of(
        ";", "--", "/*", "*/", "xp_", "sp_", "exec", "execute",
        "union", "select", "insert", "update", "delete", "drop",
        "create", "alter", "truncate", "script", "<", ">"
    );

    private InputValidators() {
    }

    public static String sanitizeSearchTerm(String term) {
        String cleaned = clean(term, "Search term");
        if (cleaned.length() < MIN_SEARCH_TERM_LENGTH) {
            throw new BadRequestException("Search term must have at least " + MIN_SEARCH_TERM_LENGTH + " characters");
        }
        if (cleaned.length() > MAX_SEARCH_TERM_LENGTH) {
            throw new BadRequestException("Search term too long (maximum " + MAX_SEARCH_TERM_LENGTH + " characters)");
        }
        rejectDangerous(cleaned, "Search term");
        return cleaned;
    }

    public static String sanitizeCategory(String categoria) {
        String cleaned = clean(categoria, "Category");
        if (cleaned.isEmpty()) {
            throw new BadRequestException("Category must not be empty");
        }
        if (cleaned.length() > MAX_CATEGORY_LENGTH) {
            throw new BadRequestException("Category too long (maximum " + MAX_CATEGORY_LENGTH + " characters)");
        }
        rejectDangerous(cleaned, "Category");
        return cleaned;
    }

    public static void validatePage(int page, int pageSize) {
        if (page < 1 || page > MAX_PAGE_NUMBER) {
            throw new BadRequestException("Page must be between 1 and " + MAX_PAGE_NUMBER);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new BadRequestException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
    }

    public static void validateId(Long id) {
        if (id == null || id < 1) {
            throw new BadRequestException("Produto id must be a positive number");
        }
    }

    private static String clean(String value, String field) {
        if (value == null) {
            throw new BadRequestException(field + " is required");
        }
        String withoutControl = CONTROL_CHARS.matcher(value.trim()).replaceAll("");
        return WHITESPACE_RUN.matcher(withoutControl).replaceAll(" ");
    }

    private static void rejectDangerous(String value, String field) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String token : DANGEROUS_TOKENS) {
            if (lower.contains(token)) {
                log.warn("Rejected {} containing forbidden token '{}'", field.toLowerCase(Locale.ROOT), token);
                throw new BadRequestException(field + " contains invalid characters");
            }
        }
    }
}
