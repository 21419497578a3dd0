package app;

import java.io.File;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Scanner;
import java.util.UUID;

import engine.SqliteDurableStore;
import shorts.ShortsWorkflow;
import shorts.config.PipelineSettings;
import shorts.config.ShortsProperties;
import shorts.gate.GateType;
import shorts.gate.ResumeRejectedException;
import shorts.graph.RunStatus;
import shorts.graph.RunStatusView;
import shorts.graph.WorkflowExecutor;
import shorts.model.EditorOutput;
import shorts.simulated.SimulatedStudio;

public class Main {

    private static final File RUN_FILE = new File("run.id");

    private static PipelineSettings settings;
    private static WorkflowExecutor executor;

    public static void main(String[] args) throws Exception {

        printHeader();

        ShortsProperties properties = ShortsProperties.load();
        settings = PipelineSettings.from(properties);
        double failureRate = properties.getDemo().getFailureRate();
        SqliteDurableStore store = new SqliteDurableStore(settings.getDatabaseUrl());
        executor = ShortsWorkflow.create(settings, store, new SimulatedStudio(failureRate, System.nanoTime()));

        if (failureRate > 0) {
            System.out.println("⚠️ Simulated services fail " + (int) (failureRate * 100) + "% of the time\n");
        }

        Scanner scanner = new Scanner(System.in);

        while (true) {
            printMenu();
            String choice = scanner.nextLine().trim();

            try {
                switch (choice) {
                    case "1" -> startRun(scanner);
                    case "2" -> answerGate(scanner);
                    case "3" -> recoverRun();
                    case "4" -> showStatus();
                    case "5" -> showRuns();
                    case "6" -> {
                        System.out.println("------ Exiting.....!------");
                        store.close();
                        System.exit(0);
                    }
                    default -> System.out.println("❌ Invalid choice");
                }
            } catch (ResumeRejectedException e) {
                System.out.println("❌ " + e.getMessage() + "\n");
            } catch (IllegalArgumentException e) {
                System.out.println("❌ " + e.getMessage() + "\n");
            }
        }
    }

    // ---------------- MENU ACTIONS ----------------

    private static void startRun(Scanner scanner) throws Exception {
        String runId = UUID.randomUUID().toString();
        Files.writeString(RUN_FILE.toPath(), runId);
        System.out.println("🆔 New Run ID: " + runId);

        System.out.print("Channel name (Enter to skip): ");
        String channel = scanner.nextLine().trim();
        System.out.print("Categories, comma separated (Enter for any): ");
        String categories = scanner.nextLine().trim();

        Map<String, Object> preferences = new LinkedHashMap<>();
        if (!channel.isEmpty()) {
            preferences.put("name", channel);
        }
        if (!categories.isEmpty()) {
            preferences.put("categories", splitList(categories));
        }

        System.out.println("▶ Researching trends...\n");
        report(executor.start(runId, "demo-user", preferences));
    }

    private static void answerGate(Scanner scanner) throws Exception {
        Optional<String> runId = currentRun();
        if (runId.isEmpty()) {
            return;
        }
        RunStatusView status = executor.status(runId.get());
        if (status.getStatus() != RunStatus.WAITING) {
            System.out.println("❌ Run is not waiting for input (" + status.getStatus() + ")\n");
            return;
        }

        GateType gate = status.getWaitingOn();
        Map<String, Object> payload = status.getPayload();
        System.out.println("\n✋ " + payload.get("message"));

        Map<String, Object> decision = switch (gate) {
            case TOPIC_SELECTION -> askTopic(scanner, payload);
            case SPEAKER_SELECTION -> askSpeakers(scanner, payload);
            case SCRIPT_REVIEW -> askReview(scanner, payload);
            case AUDIO_CHOICE -> askAudio(scanner, payload);
            case HOOK_PROMPT -> askHook(scanner, payload);
        };

        System.out.println("▶ Resuming from " + gate.tag() + "...\n");
        report(executor.resume(runId.get(), gate, decision));
    }

    private static void recoverRun() throws Exception {
        Optional<String> runId = currentRun();
        if (runId.isEmpty()) {
            return;
        }
        System.out.println("🔁 Recovering run from its last checkpoint...\n");
        report(executor.advance(runId.get()));
    }

    private static void showStatus() throws Exception {
        Optional<String> runId = currentRun();
        if (runId.isPresent()) {
            report(executor.status(runId.get()));
        }
    }

    // ---------------- GATE PROMPTS ----------------

    private static Map<String, Object> askTopic(Scanner scanner, Map<String, Object> payload) {
        List<Map<String, Object>> topics = listOfMaps(payload.get("topics"));
        for (int i = 0; i < topics.size(); i++) {
            System.out.printf("  %d. %s - %s%n", i + 1, topics.get(i).get("keyword"), topics.get(i).get("summary"));
        }
        Object recommended = payload.get("recommended_topic");
        System.out.print("Pick a number (Enter for \"" + recommended + "\"): ");
        String answer = scanner.nextLine().trim();

        String topic = answer.isEmpty()
                ? String.valueOf(recommended)
                : String.valueOf(topics.get(Integer.parseInt(answer) - 1).get("keyword"));
        return Map.of("selected_topic", topic);
    }

    private static Map<String, Object> askSpeakers(Scanner scanner, Map<String, Object> payload) {
        for (Map<String, Object> member : listOfMaps(payload.get("members"))) {
            System.out.printf("  • %-10s %s (%s)%n", member.get("key"), member.get("name"), member.get("description"));
        }
        System.out.print("Host key: ");
        String host = scanner.nextLine().trim();
        System.out.print("Participant keys, comma separated: ");
        String participants = scanner.nextLine().trim();

        Map<String, Object> decision = new LinkedHashMap<>();
        decision.put("host", host);
        decision.put("participants", splitList(participants));
        return decision;
    }

    private static Map<String, Object> askReview(Scanner scanner, Map<String, Object> payload) {
        System.out.println("📄 Script: " + payload.get("script_file_path"));
        System.out.print("Approve? (y/n): ");
        boolean approved = scanner.nextLine().trim().equalsIgnoreCase("y");

        Map<String, Object> decision = new LinkedHashMap<>();
        decision.put("approved", approved);
        if (!approved) {
            System.out.print("Feedback for the writer: ");
            decision.put("feedback", scanner.nextLine().trim());
        }
        return decision;
    }

    private static Map<String, Object> askAudio(Scanner scanner, Map<String, Object> payload) {
        System.out.print("Audio source (tts/manual, Enter for tts): ");
        String source = scanner.nextLine().trim();

        Map<String, Object> decision = new LinkedHashMap<>();
        if (!source.equalsIgnoreCase("manual")) {
            decision.put("audio_source", "tts");
            return decision;
        }

        Map<String, String> files = new LinkedHashMap<>();
        for (Map<String, Object> scene : listOfMaps(payload.get("scenes"))) {
            System.out.printf("  [%s] %s%n  Recording path (Enter to skip): ", scene.get("scene_id"), scene.get("text"));
            String path = scanner.nextLine().trim();
            if (!path.isEmpty()) {
                files.put(String.valueOf(scene.get("scene_id")), path);
            }
        }
        decision.put("audio_source", "manual");
        decision.put("audio_files", files);
        return decision;
    }

    private static Map<String, Object> askHook(Scanner scanner, Map<String, Object> payload) {
        System.out.println("🎬 Hook prompt: " + payload.get("prompt"));
        System.out.print("New prompt (Enter to keep): ");
        String prompt = scanner.nextLine().trim();
        System.out.print("Hook mode (video/image, Enter for video): ");
        String mode = scanner.nextLine().trim();

        Map<String, Object> decision = new LinkedHashMap<>();
        if (!prompt.isEmpty()) {
            decision.put("prompt", prompt);
        }
        decision.put("hook_mode", mode.isEmpty() ? "video" : mode);
        return decision;
    }

    // ---------------- STATE VIEW ----------------

    private static void showRuns() {
        System.out.println("\n📊 Runs (from SQLite)");
        System.out.println("--------------------------------");

        try (Connection conn = DriverManager.getConnection(settings.getDatabaseUrl());
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT run_id, stage, suspension_stage, updated_at FROM runs ORDER BY updated_at")) {

            while (rs.next()) {
                String suspended = rs.getString("suspension_stage");
                System.out.printf("• %-36s : %-18s %s%n",
                        rs.getString("run_id"),
                        rs.getString("stage"),
                        suspended == null ? "" : "(waiting)");
            }
        } catch (Exception e) {
            System.out.println("❌ Failed to read DB: " + e.getMessage());
        }

        System.out.println();
    }

    private static void report(RunStatusView view) {
        System.out.println("📍 Stage: " + view.getStage().key() + "  Status: " + view.getStatus());
        if (!view.getRetryCounts().isEmpty()) {
            System.out.println("🔁 Attempts: " + view.getRetryCounts());
        }
        if (view.getQuality() != null) {
            System.out.println("🧪 Quality: " + view.getQuality());
        }

        switch (view.getStatus()) {
            case WAITING -> System.out.println("✋ Waiting on " + view.getWaitingOn().tag()
                    + ". Choose option 2 to answer.\n");
            case FAILED -> System.out.println("💥 Run failed: " + view.getError() + "\n");
            case COMPLETED -> {
                EditorOutput output = executor.result(view.getRunId()).orElse(EditorOutput.empty());
                System.out.println(output.isDegraded()
                        ? "⚠️ Finished with a degraded edit"
                        : "🎉 Short finished successfully!");
                System.out.println("🎞  " + output.getFinalVideoPath());
                System.out.println("💬 " + output.getCaptionSrtPath() + "\n");
            }
            case RUNNING -> System.out.println("⏳ Interrupted mid-stage. Choose option 3 to recover.\n");
        }
    }

    // ---------------- HELPERS ----------------

    private static Optional<String> currentRun() throws Exception {
        if (!RUN_FILE.exists()) {
            System.out.println("❌ No run yet. Start a new run first.\n");
            return Optional.empty();
        }
        String runId = Files.readString(RUN_FILE.toPath()).trim();
        System.out.println("🆔 Run ID: " + runId);
        return Optional.of(runId);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<Object>) value) {
                if (item instanceof Map) {
                    result.add((Map<String, Object>) item);
                }
            }
        }
        return result;
    }

    private static List<String> splitList(String csv) {
        List<String> values = new ArrayList<>();
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }

    private static void printHeader() {
        System.out.println("""
                ========================================
                🎙  Podcast Shorts Engine – Demo CLI
                ========================================
                This demo shows:
                ✔ Checkpointed runs (SQLite)
                ✔ Human review gates that survive restarts
                ✔ Quality-gated retries
                ✔ Recovery from the last checkpoint
                ----------------------------------------
                """);
    }

    private static void printMenu() {
        System.out.println("""
                Choose an option:

                1️⃣  Start a new run
                2️⃣  Answer the waiting review gate
                3️⃣  Recover run from last checkpoint
                4️⃣  View run status
                5️⃣  List runs in the database
                6️⃣  Exit

                Enter choice:
                """);
    }
}
