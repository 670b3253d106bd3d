package my.performancemanager.app.scoring;

public record GapClosure(String staffId, String competencyId) {
}
