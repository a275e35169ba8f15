package com.ryuqq.chronicle.adapter.inmemory;

/**
 * Subject wildcard matching.
 *
 * <p>{@code *} matches exactly one token, {@code >} matches one or more trailing tokens.</p>
 */
final class SubjectPattern {

    private SubjectPattern() {
    }

    static boolean matches(String pattern, String subject) {
        String[] patternTokens = pattern.split("\\.", -1);
        String[] subjectTokens = subject.split("\\.", -1);

        for (int i = 0; i < patternTokens.length; i++) {
            String token = patternTokens[i];
            if (token.equals(">")) {
                return subjectTokens.length > i;
            }
            if (i >= subjectTokens.length) {
                return false;
            }
            if (!token.equals("*") && !token.equals(subjectTokens[i])) {
                return false;
            }
        }
        return patternTokens.length == subjectTokens.length;
    }

    /**
     * Whether some concrete subject is matched by both patterns.
     */
    static boolean overlaps(String left, String right) {
        String[] leftTokens = left.split("\\.", -1);
        String[] rightTokens = right.split("\\.", -1);

        int common = Math.min(leftTokens.length, rightTokens.length);
        for (int i = 0; i < common; i++) {
            String a = leftTokens[i];
            String b = rightTokens[i];
            if (a.equals(">") || b.equals(">")) {
                return true;
            }
            if (!a.equals("*") && !b.equals("*") && !a.equals(b)) {
                return false;
            }
        }
        return leftTokens.length == rightTokens.length;
    }

    static boolean isWildcard(String subject) {
        return subject.contains("*") || subject.contains(">");
    }
}
