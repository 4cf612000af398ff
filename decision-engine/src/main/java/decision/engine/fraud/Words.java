package decision.engine.fraud;

final class Words {
    private Words() {
    }

    static String[] split(String text) {
        if (text == null) {
            return new String[0];
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }
}
