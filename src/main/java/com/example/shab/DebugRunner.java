package com.example.shab;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.Optional;

/**
 * Fetches and parses one publication and prints it as JSON. {@code --store} also ingests it.
 */
public class DebugRunner {
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: DebugRunner <publication-id> [--store]");
            System.exit(2);
        }
        String id = args[0];
        boolean store = args.length > 1 && "--store".equals(args[1]);
        System.out.println("=== Debug Runner: " + id + " ===");
        AppContext.init();
        IngestionService service = AppContext.getIngestionService();

        try {
            Optional<ParsedPublication> publication = service.preview(id);
            if (publication.isEmpty()) {
                System.out.println("Not an auction publication");
            } else {
                System.out.println(AppContext.getObjectMapper().writerWithDefaultPrettyPrinter()
                        .writeValueAsString(publication.get()));
            }
        } catch (IngestionException e) {
            System.err.println(e.getKind() + " error: " + e.getMessage());
            e.printStackTrace();
        } catch (JsonProcessingException e) {
            System.err.println("Cannot print publication: " + e.getMessage());
            e.printStackTrace();
        }

        if (store) {
            System.out.println("\n--- Storing ---");
            System.out.println(service.ingest(id));
        }
        System.out.println("\n=== Debug Runner Finished ===");
    }
}
