package benchgrid.logger.service;

import benchgrid.logger.model.ExportDocument;
import benchgrid.logger.model.GroupStats;
import benchgrid.logger.model.LogSnapshot;
import benchgrid.logger.model.TaskInstance;
import benchgrid.protocol.ProtocolException;
import benchgrid.util.Jsons;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only queries answered on the logger port.
 *
 * <pre>
 * QUERY SUMMARY
 * QUERY SNAPSHOT
 * QUERY INSTANCE &lt;instance_id&gt;
 * QUERY NODE &lt;node&gt;
 * QUERY TYPE &lt;task_type&gt;
 * </pre>
 *
 * Every answer is a single line of JSON.
 */
public class QueryService {

    public static final String PREFIX = "QUERY";

    private final TimelineStore store;

    public QueryService(TimelineStore store) {
        this.store = store;
    }

    public static boolean isQuery(String message) {
        if (message == null) {
            return false;
        }
        String trimmed = message.trim();
        return trimmed.equals(PREFIX) || trimmed.startsWith(PREFIX + " ");
    }

    public String answer(String message) {
        String[] parts = message.trim().split("\\s+");
        if (parts.length < 2) {
            throw new ProtocolException("QUERY without a target");
        }
        String target = parts[1];
        String arg = parts.length > 2 ? parts[2] : null;

        return switch (target) {
            case "SUMMARY" -> Jsons.toJson(store.summary());
            case "SNAPSHOT" -> {
                LogSnapshot snapshot = store.snapshot();
                yield Jsons.toJson(ExportDocument.of(snapshot,
                        System.currentTimeMillis() / 1000.0, LocalDateTime.now().toString()));
            }
            case "INSTANCE" -> {
                String id = require(arg, target);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("instance_id", id);
                out.put("found", false);
                store.instance(id).ifPresent(t -> {
                    out.put("found", true);
                    out.put("instance", t);
                });
                yield Jsons.toJson(out);
            }
            case "NODE" -> {
                String node = require(arg, target);
                yield group("node", node, store.instancesWhere(t -> node.equals(t.node())));
            }
            case "TYPE" -> {
                String type = require(arg, target);
                yield group("task_name", type, store.instancesWhere(t -> type.equals(t.taskType())));
            }
            default -> throw new ProtocolException("unknown query '" + target + "'");
        };
    }

    private static String group(String keyName, String key, Map<String, TaskInstance> instances) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(keyName, key);
        out.put("stats", GroupStats.of(new ArrayList<>(instances.values())));
        out.put("tasks", instances);
        return Jsons.toJson(out);
    }

    private static String require(String arg, String target) {
        if (arg == null) {
            throw new ProtocolException("QUERY " + target + " needs an argument");
        }
        return arg;
    }
}
