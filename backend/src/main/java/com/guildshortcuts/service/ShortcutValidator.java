package com.guildshortcuts.service;

import com.guildshortcuts.exception.ValidationException;
import com.guildshortcuts.model.entity.ShortcutEntry;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Field rules shared by the command surface and the CSV import.
 */
@Component
public class ShortcutValidator {

    public static final int MAX_NAME_LENGTH = 20;
    public static final int MAX_CATEGORY_LENGTH = 50;
    public static final int MIN_PAGE_SIZE = 1;
    public static final int MAX_PAGE_SIZE = 25;

    private static final Pattern CATEGORY_CHARSET = Pattern.compile("[A-Za-z0-9 _-]+");

    public void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new ValidationException("Shortcut name cannot be empty");
        }
        if (name.codePointCount(0, name.length()) > MAX_NAME_LENGTH) {
            throw new ValidationException(
                    "Shortcut names can only be up to " + MAX_NAME_LENGTH + " characters long");
        }
    }

    public void validateValue(String value) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException("Shortcut value cannot be empty");
        }
    }

    /**
     * Returns the category to store: blank means "General", anything else must
     * pass the length and charset rules unchanged.
     */
    public String normalizeCategory(String category) {
        if (category == null || category.isBlank()) {
            return ShortcutEntry.DEFAULT_CATEGORY;
        }
        if (category.codePointCount(0, category.length()) > MAX_CATEGORY_LENGTH) {
            throw new ValidationException(
                    "Category names can only be up to " + MAX_CATEGORY_LENGTH + " characters long");
        }
        if (!CATEGORY_CHARSET.matcher(category).matches()) {
            throw new ValidationException(
                    "Category names may only contain letters, digits, spaces, hyphens and underscores");
        }
        return category;
    }

    public void validatePrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new ValidationException("Prefix cannot be empty");
        }
    }

    public void validatePageSize(Integer pageSize) {
        if (pageSize == null || pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE) {
            throw new ValidationException(
                    "Page size must be between " + MIN_PAGE_SIZE + " and " + MAX_PAGE_SIZE);
        }
    }
}
