package com.github.statechart;

/**
 * The region of a composite state. Children are simple states only. The composite keeps a single
 * history slot in the generated machine when any transition targets its history.
 */
public final class Composite extends Region {
  private final String ownerName;
  private boolean history;

  Composite(final String ownerName) {
    this.ownerName = ownerName;
  }

  @Override
  public String getOwnerName() {
    return ownerName;
  }

  public boolean hasHistory() {
    return history;
  }

  void enableHistory() {
    checkNotSealed();
    history = true;
  }

  @Override
  public boolean equals(final Object obj) {
    return super.equals(obj) && history == ((Composite) obj).history;
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + (history ? 1 : 0);
  }

  @Override
  public String toString() {
    return "Composite [owner=" + ownerName + ", states=" + getStates().keySet() + ", history="
        + history + "]";
  }
}
