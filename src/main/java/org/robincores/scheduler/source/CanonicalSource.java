package org.robincores.scheduler.source;

import java.util.ArrayList;
import java.util.List;

// Output of the canonicalization pipeline
public class CanonicalSource {
  private final List<String> pre;
  private final List<SourceLine> body;
  private final List<String> post;
  private final Integer indentation;
  private final LoopRegion loop;
  private final String startLabel;
  private final String endLabel;

  public CanonicalSource(List<String> pre, List<SourceLine> body, List<String> post,
                         Integer indentation, LoopRegion loop) {
    this(pre, body, post, indentation, loop, null, null);
  }

  public CanonicalSource(List<String> pre, List<SourceLine> body, List<String> post,
                         Integer indentation, LoopRegion loop, String startLabel, String endLabel) {
    this.pre = pre;
    this.body = body;
    this.post = post;
    this.indentation = indentation;
    this.loop = loop;
    this.startLabel = startLabel;
    this.endLabel = endLabel;
  }

  public List<String> getPre() {
    return pre;
  }

  // Simplified body lines: one instruction each, macros unfolded, aliases resolved
  public List<SourceLine> getBody() {
    return body;
  }

  public List<String> getPost() {
    return post;
  }

  // Dominant indentation of the original body, or null
  public Integer getIndentation() {
    return indentation;
  }

  // The loop the body was taken from, or null if a plain region was extracted
  public LoopRegion getLoop() {
    return loop;
  }

  // Label that opened the body in the source, or null
  public String getStartLabel() {
    return startLabel;
  }

  // Label that closed the body in the source, or null
  public String getEndLabel() {
    return endLabel;
  }

  /**
   * Puts a rendered body back in place of the original one. The region labels are restored, and a
   * loop gets its start label and counter decrement and branch re-emitted around the body.
   */
  public List<String> wrap(List<String> renderedBody, int indentation) {
    List<String> res = new ArrayList<>(pre);
    if (loop != null) {
      Loop emitter = new Loop(loop.getLabel());
      res.addAll(emitter.start(loop.getCounter(), indentation, 0, 1, null));
      res.addAll(renderedBody);
      res.addAll(emitter.end(loop, indentation));
      res.addAll(post);
      return res;
    }
    if (startLabel != null) {
      res.add(startLabel + ":");
    }
    res.addAll(renderedBody);
    if (endLabel != null) {
      // The first epilogue line holds whatever followed the end label's colon
      res.add(endLabel + ":" + post.get(0));
      res.addAll(post.subList(1, post.size()));
    } else {
      res.addAll(post);
    }
    return res;
  }
}
