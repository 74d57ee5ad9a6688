package com.flamingo.ai.reindexer.service.content;

import com.flamingo.ai.reindexer.exception.ContentSourceException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read access to the hierarchical content source. */
public interface ContentSourceClient {

  /**
   * Fetches the whole tree of a dimension.
   *
   * @param dimension the dimension name
   * @return the root node, empty if the dimension does not exist
   * @throws ContentSourceException if the content source cannot be queried
   */
  Optional<RepoNode> fetchTree(String dimension);

  /**
   * Resolves canonical locations for node ids in one round trip.
   *
   * @param dimension the dimension name
   * @param ids the node ids
   * @return node id to URI; ids without a location are absent
   * @throws ContentSourceException if the content source cannot be queried
   */
  Map<String, String> resolveUris(String dimension, List<String> ids);
}
