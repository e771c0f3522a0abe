package ru.oparin.newsletter.service.delivery;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Экспоненциальная задержка между попытками отправки.
 * Попытка n ждет {@code min(cap, base * 2^(n-1))}, уменьшенное на случайную долю в пределах jitter.
 */
public class BackoffPolicy {

    private final Duration base;
    private final Duration cap;
    private final double jitter;
    private final DoubleSupplier random;

    /**
     * @param base   задержка после первой неудачной попытки
     * @param cap    максимальная задержка
     * @param jitter доля случайного уменьшения задержки, от 0 до 1
     * @param random источник случайных чисел в диапазоне [0, 1)
     */
    public BackoffPolicy(Duration base, Duration cap, double jitter, DoubleSupplier random) {
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("Задержки backoff не могут быть отрицательными");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("Jitter должен быть в диапазоне [0, 1]: " + jitter);
        }
        this.base = base;
        this.cap = cap;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Задержка перед следующей попыткой после неудачной попытки с номером attempt.
     *
     * @param attempt номер неудачной попытки, начиная с 1
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Номер попытки начинается с 1: " + attempt);
        }
        long capMillis = cap.toMillis();
        long delayMillis = base.toMillis();
        for (int i = 1; i < attempt && delayMillis < capMillis; i++) {
            delayMillis *= 2;
        }
        delayMillis = Math.min(delayMillis, capMillis);

        long jitterMillis = (long) (delayMillis * jitter * random.getAsDouble());
        return Duration.ofMillis(delayMillis - jitterMillis);
    }
}
