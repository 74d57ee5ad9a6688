package com.flamingo.ai.reindexer.service.build;

import com.flamingo.ai.reindexer.exception.BuildInProgressException;

/** Runs full re-index builds. */
public interface BuildService {

  /**
   * Builds a new revision of every configured index and commits it only if every index went
   * through and at least one document was written; otherwise the revision is reverted.
   *
   * @return the build report, for committed and reverted builds alike
   * @throws BuildInProgressException if a build is already running in this process
   * @throws RuntimeException if initialize, commit or revert fail
   */
  BuildReport run();

  /** Requests the running build to stop before its next index; the build is then reverted. */
  void cancel();

  boolean isRunning();
}
