package work.pollochang.particles.image.report;

public record GenerationReport(GenerationOutcome outcome, int particleCount, long elapsedMillis) {

    public static GenerationReport failed(GenerationOutcome outcome) {
        return new GenerationReport(outcome, 0, 0L);
    }
}
