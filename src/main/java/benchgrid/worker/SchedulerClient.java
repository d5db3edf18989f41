package benchgrid.worker;

import benchgrid.catalog.TaskSpec;
import benchgrid.net.LineClient;
import benchgrid.protocol.ProtocolException;
import benchgrid.protocol.SchedulerReply;
import benchgrid.protocol.SchedulerRequest;
import benchgrid.scheduler.model.SchedulerStatus;
import benchgrid.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Node side of the scheduler protocol. Each call is one fresh connection.
 */
public final class SchedulerClient {

    private final LineClient client;

    public SchedulerClient(String host, int port, Duration connectTimeout, Duration readTimeout) {
        this.client = new LineClient(host, port, connectTimeout, readTimeout);
    }

    /**
     * Register a node.
     *
     * @return the scheduler's hostname
     * @throws ProtocolException if the scheduler did not confirm
     */
    public String register(String nodeId) throws IOException {
        String reply = client.exchange(SchedulerRequest.register(nodeId).format());
        return SchedulerReply.parseConfirm(reply)
                .orElseThrow(() -> new ProtocolException("registration not confirmed: '" + reply + "'"));
    }

    /**
     * Ask for the next task.
     *
     * @return the assigned task, or empty when the scheduler says REST
     */
    public Optional<TaskSpec> requestTask(String nodeId) throws IOException {
        String reply = client.exchange(SchedulerRequest.taskRequest(nodeId).format());
        if (reply == null) {
            throw new ProtocolException("scheduler closed the connection without an assignment");
        }
        return SchedulerReply.parseAssign(reply);
    }

    /**
     * Report that the node's current task finished.
     */
    public void finish(String nodeId, double durationSeconds) throws IOException {
        client.send(SchedulerRequest.taskFinish(durationSeconds, nodeId).format());
    }

    public SchedulerStatus status() throws IOException {
        String reply = client.exchange(SchedulerRequest.status().format());
        try {
            return Jsons.mapper().readValue(SchedulerReply.parseStatus(reply), SchedulerStatus.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("invalid status report: '" + reply + "'", e);
        }
    }

    @Override
    public String toString() {
        return client.toString();
    }
}
