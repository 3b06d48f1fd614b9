package com.poc.integration.generator;

import net.datafaker.Faker;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random values for generated customers. One Faker per thread, randomness from ThreadLocalRandom,
 * so a single instance can be shared by ingestion workers.
 */
public class RandomDataProvider {

    private static final ThreadLocal<Faker> FAKER = ThreadLocal.withInitial(Faker::new);

    public Faker faker() {
        return FAKER.get();
    }

    public Random random() {
        return ThreadLocalRandom.current();
    }

    public String firstName() {
        return lettersOnly(faker().name().firstName());
    }

    public String lastName() {
        return lettersOnly(faker().name().lastName());
    }

    public String streetAddress() {
        return faker().address().streetAddress();
    }

    public String city() {
        return faker().address().city();
    }

    public String usState() {
        return faker().address().stateAbbr();
    }

    public String zipCode() {
        return String.format("%05d", random().nextInt(90000) + 10000);
    }

    public String phoneNumber() {
        return String.format("+1-555-%04d", random().nextInt(9000) + 1000);
    }

    /**
     * ISO date-time within the last {@code maxDaysAgo} days.
     */
    public String recentDateTime(int maxDaysAgo) {
        return LocalDateTime.now().minusDays(randomInt(1, maxDaysAgo)).withNano(0).toString();
    }

    public LocalDate recentDate(int maxDaysAgo) {
        return LocalDate.now().minusDays(randomInt(1, maxDaysAgo));
    }

    public BigDecimal money(double min, double max) {
        double value = min + random().nextDouble() * (max - min);
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    public int randomInt(int min, int max) {
        return random().nextInt(max - min + 1) + min;
    }

    public boolean randomBoolean() {
        return random().nextBoolean();
    }

    public <T> T randomChoice(List<T> choices) {
        return choices.get(random().nextInt(choices.size()));
    }

    // Faker names may carry apostrophes or spaces that make awkward email local parts.
    private static String lettersOnly(String value) {
        String letters = value.replaceAll("[^A-Za-z]", "");
        return letters.isEmpty() ? "Alex" : letters;
    }
}
