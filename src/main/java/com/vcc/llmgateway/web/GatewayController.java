package com.vcc.llmgateway.web;

import com.vcc.llmgateway.model.CompletionCommand;
import com.vcc.llmgateway.service.Admission;
import com.vcc.llmgateway.service.AdmissionPipeline;
import com.vcc.llmgateway.service.CompletionRequestReader;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
public class GatewayController {
  private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

  static final String CONVERSATION_HEADER = "X-Conversation-Id";
  static final String CACHE_HEADER = "X-Cache";
  static final String REMAINING_BUDGET_HEADER = "X-Remaining-Budget";

  private final CompletionRequestReader requestReader;
  private final AdmissionPipeline pipeline;

  public GatewayController(CompletionRequestReader requestReader, AdmissionPipeline pipeline) {
    this.requestReader = requestReader;
    this.pipeline = pipeline;
  }

  @PostMapping(path = "/{tenantId}/v1/completions")
  public Mono<Void> completions(
      @PathVariable String tenantId,
      ServerHttpRequest request,
      ServerHttpResponse response,
      @RequestBody(required = false) byte[] body) {
    String requestId = UUID.randomUUID().toString();
    AtomicReference<Boolean> stream = new AtomicReference<>();

    return Mono.fromCallable(() -> requestReader.read(body))
        .doOnNext(command -> stream.set(command.isStream()))
        .flatMap(command -> pipeline.admit(tenantId, request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION), command))
        .flatMap(admission -> admission.command().isStream()
            ? writeStreamed(admission, response, requestId)
            : writeBuffered(admission, response))
        .doOnTerminate(
            () ->
                log.info(
                    "requestId={} tenantId={} stream={} status={}",
                    requestId,
                    tenantId,
                    stream.get(),
                    response.getStatusCode() != null ? response.getStatusCode().value() : "n/a"));
  }

  private Mono<Void> writeBuffered(Admission admission, ServerHttpResponse response) {
    return pipeline
        .completeBuffered(admission)
        .flatMap(
            upstream -> {
              response.setStatusCode(HttpStatusCode.valueOf(upstream.status()));
              HttpHeaders headers = response.getHeaders();
              headers.setContentType(upstream.contentType());
              applyCommonHeaders(headers, admission);
              if (isCacheable(admission)) {
                headers.set(CACHE_HEADER, upstream.fromCache() ? "HIT" : "MISS");
              }
              return response.writeWith(Mono.just(response.bufferFactory().wrap(upstream.body())));
            });
  }

  private Mono<Void> writeStreamed(Admission admission, ServerHttpResponse response, String requestId) {
    return pipeline
        .completeStreamed(admission, requestId)
        .flatMap(
            body -> {
              response.setStatusCode(HttpStatus.OK);
              HttpHeaders headers = response.getHeaders();
              headers.setContentType(MediaType.TEXT_EVENT_STREAM);
              headers.setCacheControl("no-cache");
              headers.set("X-Accel-Buffering", "no");
              applyCommonHeaders(headers, admission);
              // Flush each chunk as soon as it arrives
              Flux<Mono<DataBuffer>> chunks = body.map(Mono::just);
              return response.writeAndFlushWith(chunks);
            });
  }

  private void applyCommonHeaders(HttpHeaders headers, Admission admission) {
    CompletionCommand command = admission.command();
    headers.set(CONVERSATION_HEADER, command.conversationId());
    headers.set(REMAINING_BUDGET_HEADER, String.valueOf(admission.reservation().getRemainingAfter()));
  }

  private boolean isCacheable(Admission admission) {
    return admission.tenant().caching().enabled() && admission.command().cacheKey() != null
        && !admission.command().cacheKey().isEmpty();
  }
}
