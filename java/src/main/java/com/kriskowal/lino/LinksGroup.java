package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** An ordered, growable collection of links that formats as a document. */
public class LinksGroup {

  private final List<Link> links;

  public LinksGroup() {
    this.links = new ArrayList<>();
  }

  public LinksGroup(List<Link> links) {
    this.links = links != null ? new ArrayList<>(links) : new ArrayList<>();
  }

  public List<Link> getLinks() {
    return Collections.unmodifiableList(links);
  }

  /** Appends a link; null is ignored. */
  public void add(Link link) {
    if (link != null) {
      links.add(link);
    }
  }

  public int size() {
    return links.size();
  }

  public boolean isEmpty() {
    return links.isEmpty();
  }

  public String format() {
    return Formatter.format(links, FormatConfig.DEFAULT);
  }

  public String format(FormatConfig config) {
    return Formatter.format(links, config);
  }

  @Override
  public String toString() {
    return format();
  }
}
