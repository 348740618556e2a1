/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.formula.ast;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Position of a parse-tree node.
 *
 * <p>A formula is a single line, so a position is a pair of 0-based character
 * offsets into the formula text; {@code start} is inclusive, {@code end} is
 * exclusive.
 */
public class Pos {
  public static final Pos ZERO = new Pos(0, 0);

  public final int start;
  public final int end;

  /** Creates a Pos. */
  public Pos(int start, int end) {
    checkArgument(start >= 0 && end >= start, "invalid pos %s-%s", start, end);
    this.start = start;
    this.end = end;
  }

  /** Creates a Pos that spans from the start of one to the end of another. */
  public static Pos sum(Pos first, Pos last) {
    return new Pos(
        Math.min(first.start, last.start), Math.max(first.end, last.end));
  }

  /** Returns a position that spans from this to another. */
  public Pos plus(Pos pos) {
    return sum(this, pos);
  }

  @Override
  public int hashCode() {
    return start * 31 + end;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.start == ((Pos) o).start
            && this.end == ((Pos) o).end;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes a description, with 1-based columns, such as "1.3-1.5". */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("1.").append(start + 1);
    if (end > start + 1) {
      buf.append("-1.").append(end);
    }
    return buf;
  }
}

// End Pos.java
