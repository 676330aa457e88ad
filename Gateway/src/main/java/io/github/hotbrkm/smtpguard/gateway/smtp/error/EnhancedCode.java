package io.github.hotbrkm.smtpguard.gateway.smtp.error;

/**
 * SMTP enhanced status code (RFC 3463), {@code class.subject.detail}.
 *
 * @param classCode first number, 2, 4 or 5 in replies
 * @param subject   second number
 * @param detail    third number
 */
public record EnhancedCode(int classCode, int subject, int detail) {

    public EnhancedCode {
        if (classCode < 0 || subject < 0 || detail < 0) {
            throw new IllegalArgumentException("enhanced code parts must be non-negative: "
                    + classCode + "." + subject + "." + detail);
        }
    }

    public static EnhancedCode of(int classCode, int subject, int detail) {
        return new EnhancedCode(classCode, subject, detail);
    }

    /**
     * Parses a dotted code such as {@code 5.7.1}.
     * <p>
     * Only the shape is checked here. Whether the class matches the reply code is up to the caller.
     *
     * @param value dotted code
     * @return parsed code
     * @throws DirectiveException with {@link DirectiveError#FORMAT} if the value is not three non-negative integers
     */
    public static EnhancedCode parse(String value) {
        if (value == null) {
            throw new DirectiveException(DirectiveError.FORMAT, "enhanced code is missing");
        }
        String[] parts = value.split("\\.", -1);
        if (parts.length != 3) {
            throw new DirectiveException(DirectiveError.FORMAT,
                    "wrong amount of enhanced code parts: " + value);
        }

        int[] numbers = new int[3];
        for (int i = 0; i < parts.length; i++) {
            numbers[i] = parsePart(parts[i], value);
        }
        return new EnhancedCode(numbers[0], numbers[1], numbers[2]);
    }

    public boolean isTransient() {
        return classCode == 4;
    }

    public boolean isPermanent() {
        return classCode == 5;
    }

    @Override
    public String toString() {
        return classCode + "." + subject + "." + detail;
    }

    private static int parsePart(String part, String value) {
        if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
            throw new DirectiveException(DirectiveError.FORMAT, "invalid enhanced code: " + value);
        }
        try {
            return Integer.parseInt(part);
        } catch (NumberFormatException e) {
            throw new DirectiveException(DirectiveError.FORMAT, "invalid enhanced code: " + value, e);
        }
    }
}
