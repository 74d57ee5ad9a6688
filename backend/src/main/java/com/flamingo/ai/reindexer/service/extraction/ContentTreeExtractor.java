package com.flamingo.ai.reindexer.service.extraction;

import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.domain.model.DocumentDescriptor;
import com.flamingo.ai.reindexer.domain.model.DocumentId;
import com.flamingo.ai.reindexer.domain.model.DocumentType;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.exception.DimensionNotFoundException;
import com.flamingo.ai.reindexer.service.content.ContentSourceClient;
import com.flamingo.ai.reindexer.service.content.RepoNode;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the content tree of one dimension into the descriptors of the nodes eligible for indexing.
 *
 * <p>A node is skipped when it is null, when it carries the configured exclude attribute (or the
 * hidden flag, if hidden nodes are skipped), or when its mime type is not supported. Descriptors
 * are returned sorted by document id.
 */
@Service
@Slf4j
public class ContentTreeExtractor {

  private final ContentSourceClient contentSourceClient;
  private final Set<String> supportedMimeTypes;
  private final String excludeAttribute;
  private final boolean skipHidden;

  public ContentTreeExtractor(
      ContentSourceClient contentSourceClient, ReindexerConfig reindexerConfig) {
    ReindexerConfig.Extraction extraction = reindexerConfig.getExtraction();
    this.contentSourceClient = contentSourceClient;
    this.supportedMimeTypes = Set.copyOf(extraction.getSupportedMimeTypes());
    this.excludeAttribute = extraction.getExcludeAttribute();
    this.skipHidden = extraction.isSkipHidden();
  }

  /**
   * Extracts the indexable descriptors of an index.
   *
   * @param indexId the index, whose id names the content dimension
   * @return descriptors sorted by document id
   * @throws DimensionNotFoundException if the content source has no tree for the index
   */
  public List<DocumentDescriptor> extract(IndexId indexId) {
    RepoNode root =
        contentSourceClient
            .fetchTree(indexId.value())
            .orElseThrow(() -> new DimensionNotFoundException(indexId.value()));

    Map<String, RepoNode> nodeMap = flatten(root);
    List<DocumentDescriptor> descriptors = new ArrayList<>();
    int skipped = 0;
    for (RepoNode node : nodeMap.values()) {
      if (isIndexable(node)) {
        descriptors.add(
            new DocumentDescriptor(
                new DocumentType(node.getMimeType()), new DocumentId(node.getId())));
      } else {
        skipped++;
      }
    }
    descriptors.sort(Comparator.comparing(DocumentDescriptor::documentId));

    log.info(
        "Extracted {} indexable nodes from dimension {} ({} nodes, {} skipped)",
        descriptors.size(),
        indexId,
        nodeMap.size(),
        skipped);
    return descriptors;
  }

  /**
   * Flattens a tree into a map keyed by node id. A later node with an already seen id replaces the
   * earlier one. Nodes reached twice by reference are visited once.
   */
  @VisibleForTesting
  static Map<String, RepoNode> flatten(RepoNode root) {
    Map<String, RepoNode> nodeMap = new LinkedHashMap<>();
    Set<RepoNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<RepoNode> stack = new ArrayDeque<>();
    if (root != null) {
      stack.push(root);
    }

    while (!stack.isEmpty()) {
      RepoNode node = stack.pop();
      if (!visited.add(node)) {
        continue;
      }
      nodeMap.put(node.getId(), node);

      List<RepoNode> children = orderedChildren(node);
      // pushed in reverse so children are visited in display order
      for (int i = children.size() - 1; i >= 0; i--) {
        RepoNode child = children.get(i);
        if (child != null) {
          stack.push(child);
        }
      }
    }
    return nodeMap;
  }

  private static List<RepoNode> orderedChildren(RepoNode node) {
    Map<String, RepoNode> nodes = node.getNodes();
    if (nodes == null || nodes.isEmpty()) {
      return List.of();
    }
    List<String> order = node.getIndex();
    if (order == null || order.isEmpty()) {
      return new ArrayList<>(nodes.values());
    }
    List<RepoNode> children = new ArrayList<>(nodes.size());
    for (String id : order) {
      RepoNode child = nodes.get(id);
      if (child != null) {
        children.add(child);
      }
    }
    // children missing from the index list are still part of the tree
    for (Map.Entry<String, RepoNode> entry : nodes.entrySet()) {
      if (!order.contains(entry.getKey())) {
        children.add(entry.getValue());
      }
    }
    return children;
  }

  @VisibleForTesting
  boolean isIndexable(RepoNode node) {
    if (node == null) {
      return false;
    }
    if (isExcluded(node)) {
      log.debug("Node {} excluded from indexing", node.getId());
      return false;
    }
    return node.getMimeType() != null && supportedMimeTypes.contains(node.getMimeType());
  }

  private boolean isExcluded(RepoNode node) {
    if (skipHidden && node.isHidden()) {
      return true;
    }
    if (excludeAttribute == null || node.getData() == null) {
      return false;
    }
    Object flag = node.getData().get(excludeAttribute);
    if (flag instanceof Boolean b) {
      return b;
    }
    return flag instanceof String s && Boolean.parseBoolean(s.trim());
  }
}
