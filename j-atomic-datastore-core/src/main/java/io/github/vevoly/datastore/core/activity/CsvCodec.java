package io.github.vevoly.datastore.core.activity;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * <h3>CSV 编解码 (CSV Codec)</h3>
 *
 * <p>
 * RFC 4180 风格：逗号分隔；包含逗号、双引号或换行的字段用双引号包裹，内部双引号写作两个双引号。
 * 读取时支持跨行的引号字段，并兼容 \r\n 行尾。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>CSV Codec.</b><br>
 * RFC 4180 style: comma separated; fields containing commas, quotes or line breaks are quoted and inner quotes doubled.
 * The reader handles quoted fields spanning lines and \r\n line endings.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public final class CsvCodec {

    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';

    private CsvCodec() {
    }

    /**
     * 格式化一行 (包含结尾换行符).
     * <br>
     * <span style="color: gray;">Format one row, including the trailing line break.</span>
     */
    public static String formatRow(List<String> cells) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(SEPARATOR);
            }
            line.append(escape(cells.get(i)));
        }
        return line.append('\n').toString();
    }

    static String escape(String cell) {
        if (cell == null) {
            return "";
        }
        boolean needsQuote = cell.indexOf(SEPARATOR) >= 0 || cell.indexOf(QUOTE) >= 0
                || cell.indexOf('\n') >= 0 || cell.indexOf('\r') >= 0;
        if (!needsQuote) {
            return cell;
        }
        return QUOTE + cell.replace("\"", "\"\"") + QUOTE;
    }

    /**
     * <h3>逐条读取 CSV 记录 (Record Reader)</h3>
     * <p>非线程安全，调用方负责关闭底层 Reader。</p>
     * <span style="color: gray;">Not thread-safe; the caller closes the underlying reader.</span>
     */
    public static class RecordReader {

        private final Reader reader;
        private int pending = -2;

        public RecordReader(Reader reader) {
            this.reader = reader;
        }

        /**
         * 读取下一条记录.
         *
         * @return 字段列表；到达文件末尾返回 null (Fields, or null at end of input)
         * @throws IOException 读取失败
         */
        public List<String> next() throws IOException {
            int c = read();
            if (c == -1) {
                return null;
            }
            List<String> cells = new ArrayList<>();
            StringBuilder cell = new StringBuilder();
            boolean quoted = false;
            while (true) {
                if (quoted) {
                    if (c == -1) {
                        // 文件在引号内结束 (写入被中断) / Input ended inside quotes (torn write)
                        cells.add(cell.toString());
                        return cells;
                    }
                    if (c == QUOTE) {
                        int next = read();
                        if (next == QUOTE) {
                            cell.append(QUOTE);
                        } else {
                            quoted = false;
                            c = next;
                            continue;
                        }
                    } else {
                        cell.append((char) c);
                    }
                } else {
                    if (c == -1 || c == '\n') {
                        cells.add(cell.toString());
                        return cells;
                    }
                    if (c == '\r') {
                        int next = read();
                        if (next != '\n') {
                            unread(next);
                        }
                        cells.add(cell.toString());
                        return cells;
                    }
                    if (c == SEPARATOR) {
                        cells.add(cell.toString());
                        cell.setLength(0);
                    } else if (c == QUOTE && cell.length() == 0) {
                        quoted = true;
                    } else {
                        cell.append((char) c);
                    }
                }
                c = read();
            }
        }

        private int read() throws IOException {
            if (pending != -2) {
                int c = pending;
                pending = -2;
                return c;
            }
            return reader.read();
        }

        private void unread(int c) {
            pending = c;
        }
    }
}
