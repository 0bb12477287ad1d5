package io.gamevault.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.gamevault.core.GameState;
import io.gamevault.storage.StoreException;

import java.io.PrintStream;
import java.util.List;

/**
 * Operator CLI for inspecting and patching stored game state.
 *
 * Usage:
 *   gamevault [options] get <gameId>
 *   gamevault [options] set <gameId> <json>
 *   gamevault [options] has <gameId>
 *
 * Exit codes: 0 ok, 1 usage error or game not found, 2 any other failure.
 */
public final class Main {

    static final int OK = 0;
    static final int USAGE_OR_NOT_FOUND = 1;
    static final int FAILURE = 2;

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        StorageConfig.CommandLine cl;
        try {
            cl = StorageConfig.parse(args);
        } catch (IllegalArgumentException e) {
            return usage(err, e.getMessage());
        }
        if (cl.helpRequested()) {
            out.println(usageText());
            return OK;
        }

        List<String> ops = cl.operands();
        if (ops.isEmpty()) {
            return usage(err, "missing command");
        }
        String cmd = ops.get(0);
        int arity = switch (cmd) {
            case "get", "has" -> 2;
            case "set" -> 3;
            default -> -1;
        };
        if (arity < 0) {
            return usage(err, "unknown command: " + cmd);
        }
        if (ops.size() != arity) {
            return usage(err, cmd + (arity == 3 ? " requires <gameId> <json>" : " requires <gameId>"));
        }
        if (ops.get(1).isBlank()) {
            return usage(err, "gameId must not be blank");
        }

        try (CachingGameStorage storage = StoreFactory.open(cl.config())) {
            storage.connect();
            return switch (cmd) {
                case "get" -> get(storage, ops.get(1), out, err);
                case "has" -> {
                    out.println(storage.has(ops.get(1)));
                    yield OK;
                }
                default -> set(storage, ops.get(1), ops.get(2), out, err);
            };
        } catch (StoreException e) {
            err.println("error: " + e.getMessage());
            return FAILURE;
        } catch (RuntimeException e) {
            e.printStackTrace(err);
            return FAILURE;
        }
    }

    private static int get(GameStorage storage, String gameId, PrintStream out, PrintStream err) {
        GameState state = storage.get(gameId);
        if (state == null) {
            err.println("(not found)");
            return USAGE_OR_NOT_FOUND;
        }
        try {
            out.println(GameState.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(state.json()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot print game state", e);
        }
        return OK;
    }

    private static int set(GameStorage storage, String gameId, String json, PrintStream out, PrintStream err) {
        GameState state;
        try {
            state = GameState.parse(json);
        } catch (IllegalArgumentException e) {
            return usage(err, e.getMessage());
        }
        storage.set(gameId, state);
        out.println("OK");
        return OK;
    }

    private static int usage(PrintStream err, String msg) {
        if (msg != null && !msg.isBlank()) {
            err.println("error: " + msg);
        }
        err.println(usageText());
        return USAGE_OR_NOT_FOUND;
    }

    private static String usageText() {
        return """
                Usage:
                  gamevault [options] get <gameId>
                  gamevault [options] set <gameId> <json>
                  gamevault [options] has <gameId>

                """ + StorageConfig.usage();
    }
}
