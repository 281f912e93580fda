package io.trialmesh.dispatch;

public record ModelResult(
        boolean success,
        int exitCode,
        String output,
        String error
) {
    public static ModelResult ok(String output) {
        return new ModelResult(true, 0, output, null);
    }

    public static ModelResult fail(int exitCode, String error) {
        return new ModelResult(false, exitCode, null, error);
    }
}
