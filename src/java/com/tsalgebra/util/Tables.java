// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.tsalgebra.util;

import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import org.apache.commons.lang.StringUtils;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Renders columns of text as a plain text table:
 * <pre>
 * Date                Value
 * =================== =====
 * 2013-01-01 00:00:00 12
 * </pre>
 * Every cell is left justified to its column's width.  Rows stop at the shortest column.
 */
public final class Tables {

  private static final Joiner CELL_JOINER = Joiner.on(' ');
  private static final Joiner LINE_JOINER = Joiner.on('\n');

  private Tables() {
    // utility
  }

  /**
   * Formats a table.
   *
   * @param columns Cells by column heading, in display order.
   * @return The rendered table, one line per row, without a trailing newline.
   */
  public static String format(Map<String, ? extends List<?>> columns) {
    checkNotNull(columns);

    List<String> headings = Lists.newArrayList(columns.keySet());
    List<List<?>> cells = Lists.newArrayList();
    List<Integer> widths = Lists.newArrayList();
    int rowCount = Integer.MAX_VALUE;
    for (Map.Entry<String, ? extends List<?>> column : columns.entrySet()) {
      int width = column.getKey().length();
      for (Object cell : column.getValue()) {
        width = Math.max(width, String.valueOf(cell).length());
      }
      cells.add(column.getValue());
      widths.add(width);
      rowCount = Math.min(rowCount, column.getValue().size());
    }
    if (headings.isEmpty()) {
      return "";
    }

    List<String> lines = Lists.newArrayList();
    List<String> line = Lists.newArrayList();
    for (int c = 0; c < headings.size(); c++) {
      line.add(StringUtils.rightPad(headings.get(c), widths.get(c)));
    }
    lines.add(CELL_JOINER.join(line));

    line.clear();
    for (int width : widths) {
      line.add(StringUtils.repeat("=", width));
    }
    lines.add(CELL_JOINER.join(line));

    for (int row = 0; row < rowCount; row++) {
      line.clear();
      for (int c = 0; c < cells.size(); c++) {
        line.add(StringUtils.rightPad(String.valueOf(cells.get(c).get(row)), widths.get(c)));
      }
      lines.add(CELL_JOINER.join(line));
    }
    return LINE_JOINER.join(lines);
  }
}
