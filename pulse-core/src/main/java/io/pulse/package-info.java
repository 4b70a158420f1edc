/**
 * Client-side support for pub/sub consumers and producers.
 *
 * <h2>Core Design</h2>
 * <p>A transport driver decodes each delivery into a {@link io.pulse.Message} and binds an
 * {@link io.pulse.AckHandler} that maps completion onto the broker's native ack/nack call.
 * Application code calls {@link io.pulse.Message#ack()} or {@link io.pulse.Message#nack()};
 * the handler fires exactly once even when several threads race to complete the message.
 *
 * <p>Operations that fail transiently (publish, connect, process) are retried through a
 * {@linkplain io.pulse.retry.Retrier retrier} whose waits come from immutable
 * {@linkplain io.pulse.retry.RetryParams retry parameters} and can be aborted with a
 * {@linkplain io.pulse.concurrent.CancellationToken cancellation token}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>pulse-core</b> - message, retry, codec, logging (depends only on ulid-creator)</li>
 *   <li><b>pulse-micrometer</b> - Micrometer bridge for {@link io.pulse.spi.RetryMetrics}</li>
 *   <li><b>pulse-spring-boot-starter</b> - auto-configuration from {@code pulse.*} properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * // inside a transport driver
 * Message message = MessageCodec.getDefault().decode(bytes).toBuilder()
 *     .ackId(deliveryTag)
 *     .receiveTime(Instant.now())
 *     .ackHandler((ackId, success, receivedAt) -> {
 *         if (success) channel.ack(ackId); else channel.reject(ackId);
 *     })
 *     .build();
 * handler.accept(message);
 *
 * // publishing with retries
 * Retrier retrier = Retrier.builder()
 *     .params(new RetryParams(BackoffStrategy.EXPONENTIAL, 5, Duration.ofMillis(20)))
 *     .build();
 * try (CancellationSource cancel = new CancellationSource().cancelAfter(Duration.ofSeconds(5))) {
 *     retrier.run(cancel.token(), () -> publisher.publish(message));
 * }
 * }</pre>
 *
 * @see io.pulse.Message
 * @see io.pulse.AckHandler
 * @see io.pulse.retry.RetryParams
 */
package io.pulse;
