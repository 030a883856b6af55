package org.robincores.scheduler.util;

import java.util.Objects;

// Represents a pair of positions i < j whose order a permutation reverses
public final class Inversion {
  public final int first;
  public final int second;
  public final int firstImage;
  public final int secondImage;

  public Inversion(int first, int second, int firstImage, int secondImage) {
    this.first = first;
    this.second = second;
    this.firstImage = firstImage;
    this.secondImage = secondImage;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Inversion)) return false;
    Inversion that = (Inversion) o;
    return first == that.first && second == that.second
        && firstImage == that.firstImage && secondImage == that.secondImage;
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second, firstImage, secondImage);
  }

  @Override
  public String toString() {
    return "(" + first + ", " + second + ")";
  }
}
