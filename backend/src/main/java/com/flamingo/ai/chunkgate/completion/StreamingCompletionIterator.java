package com.flamingo.ai.chunkgate.completion;

import com.flamingo.ai.chunkgate.exception.LlmServiceException;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Bridges LangChain4j's callback-style streaming into a pull-based iterator. The request is started
 * on the first call to {@link #hasNext()}.
 */
class StreamingCompletionIterator implements Iterator<String>, StreamingChatResponseHandler {

  private static final Object END = new Object();

  private final BlockingQueue<Object> fragments = new LinkedBlockingQueue<>();
  private final Consumer<StreamingChatResponseHandler> request;
  private final CancellationSignal cancellation;

  private boolean started;
  private boolean finished;
  private String next;

  StreamingCompletionIterator(
      Consumer<StreamingChatResponseHandler> request, CancellationSignal cancellation) {
    this.request = request;
    this.cancellation = cancellation;
  }

  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (finished) {
      return false;
    }
    if (!started) {
      started = true;
      request.accept(this);
    }
    cancellation.throwIfCancellationRequested();

    Object item = take();
    if (item == END) {
      finished = true;
      return false;
    }
    if (item instanceof Throwable error) {
      finished = true;
      throw new LlmServiceException("Streaming completion failed: " + error.getMessage(), error);
    }
    next = (String) item;
    return true;
  }

  @Override
  public String next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    String fragment = next;
    next = null;
    return fragment;
  }

  @Override
  public void onPartialResponse(String partialResponse) {
    if (partialResponse != null && !partialResponse.isEmpty()) {
      fragments.add(partialResponse);
    }
  }

  @Override
  public void onCompleteResponse(ChatResponse completeResponse) {
    fragments.add(END);
  }

  @Override
  public void onError(Throwable error) {
    fragments.add(error);
  }

  private Object take() {
    try {
      return fragments.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      finished = true;
      throw new LlmServiceException("Interrupted while waiting for completion fragments", e);
    }
  }
}
