package com.ospicorp.migrationflow.config;

import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.MDC;

/** Runs tasks on a delegate executor with the submitting thread's MDC. */
public class MdcPropagatingExecutor implements Executor {

  private final Executor delegate;

  public MdcPropagatingExecutor(Executor delegate) {
    this.delegate = delegate;
  }

  @Override
  public void execute(Runnable command) {
    Map<String, String> parentMdc = MDC.getCopyOfContextMap();
    delegate.execute(() -> {
      if (parentMdc != null) {
        MDC.setContextMap(parentMdc);
      }
      try {
        command.run();
      } finally {
        MDC.clear();
      }
    });
  }
}
