package org.example.learnpath.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Moves the correct option to a uniformly chosen slot so answers do not cluster on one letter.
 * Only the leading "X)" label and list position of the two swapped options change.
 */
@Component
public class OptionRandomizer {

    private static final String SLOTS = "ABCD";

    private final Random random;

    public OptionRandomizer() {
        this(new Random());
    }

    public OptionRandomizer(Random random) {
        this.random = random;
    }

    public RandomizedOptions randomize(List<String> options, String correctSlot) {
        if (options == null || options.size() < 2 || correctSlot == null || correctSlot.isBlank()) {
            return new RandomizedOptions(options == null ? List.of() : List.copyOf(options), correctSlot);
        }
        String current = correctSlot.trim().toUpperCase(Locale.ROOT);
        int currentIndex = -1;
        for (int i = 0; i < options.size(); i++) {
            String option = options.get(i);
            if (option != null && option.startsWith(current + ")")) {
                currentIndex = i;
                break;
            }
        }
        if (currentIndex < 0) {
            return new RandomizedOptions(List.copyOf(options), correctSlot);
        }

        int slotCount = Math.min(options.size(), SLOTS.length());
        int targetIndex = random.nextInt(slotCount);
        if (targetIndex == currentIndex) {
            return new RandomizedOptions(List.copyOf(options), current);
        }
        String target = String.valueOf(SLOTS.charAt(targetIndex));

        List<String> reordered = new ArrayList<>(options);
        String correctOption = options.get(currentIndex);
        String displacedOption = options.get(targetIndex);
        reordered.set(targetIndex, relabel(correctOption, target));
        reordered.set(currentIndex, relabel(displacedOption, current));
        return new RandomizedOptions(List.copyOf(reordered), target);
    }

    static String relabel(String option, String letter) {
        int close = option.indexOf(')');
        if (close == 1 && Character.isLetter(option.charAt(0))) {
            return letter + option.substring(1);
        }
        return letter + ") " + option;
    }

    public record RandomizedOptions(List<String> options, String correctSlot) {
    }
}
