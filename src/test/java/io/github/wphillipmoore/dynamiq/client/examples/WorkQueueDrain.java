package io.github.wphillipmoore.dynamiq.client.examples;

import io.github.wphillipmoore.dynamiq.client.DynamiqClient;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqNotFoundException;
import io.github.wphillipmoore.dynamiq.client.message.ReceivedMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Work queue drain.
 *
 * <p>Receives batches from a queue, hands every message to a handler and acknowledges the ones the
 * handler accepted with a single batched delete. Stops when a batch comes back empty. Messages the
 * handler rejects are left unacknowledged and become visible again after the queue's visibility
 * timeout.
 *
 * <p>Set {@code DYNAMIQ_QUEUE} and {@code DYNAMIQ_BATCH_SIZE} to choose the queue and batch size.
 */
public final class WorkQueueDrain {

  /** Totals for one drain run. */
  public record DrainReport(String queue, int batches, int received, long acknowledged) {}

  /** Drain a queue, acknowledging every message the handler accepts. */
  public static DrainReport drain(
      DynamiqClient client, String queue, int batchSize, Predicate<ReceivedMessage> handler) {
    int batches = 0;
    int received = 0;
    long acknowledged = 0;

    while (true) {
      List<ReceivedMessage> batch = client.receive(queue, batchSize);
      if (batch.isEmpty()) {
        break;
      }
      batches++;
      received += batch.size();

      List<String> done = new ArrayList<>();
      for (ReceivedMessage message : batch) {
        if (handler.test(message)) {
          done.add(message.id());
        }
      }
      if (!done.isEmpty()) {
        acknowledged += client.acknowledgeMany(queue, done);
      }
      if (done.size() < batch.size()) {
        break;
      }
    }
    return new DrainReport(queue, batches, received, acknowledged);
  }

  /** Run the drain and print a summary. */
  public static DrainReport run(DynamiqClient client, String queue, int batchSize) {
    DrainReport report;
    try {
      report =
          drain(
              client,
              queue,
              batchSize,
              message -> {
                System.out.printf("%-20s %s%n", message.id(), message.body());
                return true;
              });
    } catch (DynamiqNotFoundException e) {
      System.out.printf("Queue %s does not exist%n", queue);
      return new DrainReport(queue, 0, 0, 0);
    }

    System.out.printf(
        "%nQueue: %s, batches: %d, received: %d, acknowledged: %d%n",
        report.queue(), report.batches(), report.received(), report.acknowledged());
    return report;
  }

  /** Entry point. */
  public static void main(String[] args) {
    DynamiqClient client =
        new DynamiqClient.Builder(
                env("DYNAMIQ_URL", "http://localhost"),
                Integer.parseInt(env("DYNAMIQ_PORT", "8081")))
            .build();

    run(
        client,
        env("DYNAMIQ_QUEUE", "jobs"),
        Integer.parseInt(env("DYNAMIQ_BATCH_SIZE", "10")));
  }

  private static String env(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }

  private WorkQueueDrain() {}
}
