package ru.oparin.newsletter.util;

import jakarta.validation.ValidationException;
import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Утилитный класс для проверки и нормализации данных подписчика.
 */
@UtilityClass
public class SubscriberValidator {

    public static final int MAX_NAME_LENGTH = 256;
    public static final int MAX_EMAIL_LENGTH = 254;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s.]+(\\.[^@\\s.]+)+$");
    private static final String FORBIDDEN_NAME_CHARACTERS = "/()\"<>\\{}";

    /**
     * Приводит email к нижнему регистру без пробелов по краям и проверяет формат.
     *
     * @param email исходный email
     * @return нормализованный email
     * @throws ValidationException если email пустой или некорректный
     */
    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationException("Email обязателен");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_EMAIL_LENGTH || !EMAIL_PATTERN.matcher(normalized).matches()) {
            throw new ValidationException("Некорректный формат email");
        }
        return normalized;
    }

    /**
     * Проверяет имя подписчика и убирает пробелы по краям.
     *
     * @param name исходное имя
     * @return имя без пробелов по краям
     * @throws ValidationException если имя пустое, слишком длинное или содержит запрещенные символы
     */
    public static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Имя обязательно");
        }
        String normalized = name.trim();
        if (normalized.codePointCount(0, normalized.length()) > MAX_NAME_LENGTH) {
            throw new ValidationException("Имя не должно превышать " + MAX_NAME_LENGTH + " символов");
        }
        for (char c : normalized.toCharArray()) {
            if (FORBIDDEN_NAME_CHARACTERS.indexOf(c) >= 0) {
                throw new ValidationException("Имя содержит недопустимый символ: " + c);
            }
        }
        return normalized;
    }
}
