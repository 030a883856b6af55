package org.robincores.scheduler.source;

import java.util.List;

// A source listing split into the part before, inside and after a labeled region
public class Region {
  private final List<String> pre;
  private final List<String> body;
  private final List<String> post;

  public Region(List<String> pre, List<String> body, List<String> post) {
    this.pre = pre;
    this.body = body;
    this.post = post;
  }

  public List<String> getPre() {
    return pre;
  }

  public List<String> getBody() {
    return body;
  }

  public List<String> getPost() {
    return post;
  }

  @Override
  public String toString() {
    return "Region{pre=" + pre + ", body=" + body + ", post=" + post + '}';
  }
}
