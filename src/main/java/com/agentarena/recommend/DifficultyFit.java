package com.agentarena.recommend;

import com.agentarena.shared.model.Difficulty;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which descriptor difficulties suit a request of a given complexity (1-5).
 */
public final class DifficultyFit {

    private DifficultyFit() {}

    public static boolean matches(Difficulty difficulty, int signatureComplexity) {
        return difficulty != null && suited(signatureComplexity).contains(difficulty);
    }

    static Set<Difficulty> suited(int signatureComplexity) {
        if (signatureComplexity <= 2) return EnumSet.of(Difficulty.BEGINNER, Difficulty.INTERMEDIATE);
        if (signatureComplexity == 3) return EnumSet.of(Difficulty.INTERMEDIATE, Difficulty.ADVANCED);
        if (signatureComplexity == 4) return EnumSet.of(Difficulty.ADVANCED, Difficulty.EXPERT);
        return EnumSet.of(Difficulty.EXPERT);
    }
}
