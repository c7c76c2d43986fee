package org.costwatch.alert.engine.datamodel.store;

import java.util.List;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class Page<T> {
  private final List<T> items;
  private final int pageNumber;
  private final int pageSize;
  private final long totalCount;

  public Page(List<T> items, int pageNumber, int pageSize, long totalCount) {
    this.items = List.copyOf(items);
    this.pageNumber = pageNumber;
    this.pageSize = pageSize;
    this.totalCount = totalCount;
  }

  public boolean hasNext() {
    return (long) (pageNumber + 1) * pageSize < totalCount;
  }
}
