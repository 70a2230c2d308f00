package io.remint.coin.output;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Minimal SpreadsheetML (XLSX) writer. Worksheets are streamed into the package one at a time, the
 * workbook parts are written on {@link #close()}. Cells use font size 8 and columns width 12.
 */
final class XlsxPackage implements Closeable {
    static final int FONT_SIZE = 8;
    static final int COLUMN_WIDTH = 12;
    // Excel keeps 15 significant digits; longer integers stay text
    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d{0,14})(\\.\\d+)?");

    private final ZipOutputStream zip;
    private final Writer writer;
    private final List<String> sheetNames = new ArrayList<>();

    XlsxPackage(Path out) throws IOException {
        if (out.toAbsolutePath().getParent() != null) Files.createDirectories(out.toAbsolutePath().getParent());
        this.zip = new ZipOutputStream(Files.newOutputStream(out));
        this.writer = new OutputStreamWriter(zip, StandardCharsets.UTF_8);
    }

    /**
     * Writes one worksheet. With {@code headerRow} the first row is bold, frozen and gets an auto filter.
     */
    void addSheet(String name, Iterator<List<String>> rows, boolean headerRow) throws IOException {
        sheetNames.add(name);
        zip.putNextEntry(new ZipEntry("xl/worksheets/sheet" + sheetNames.size() + ".xml"));
        writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        writer.write("<worksheet xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\">");
        if (headerRow) {
            writer.write("<sheetViews><sheetView workbookViewId=\"0\"><pane ySplit=\"1\" topLeftCell=\"A2\" activePane=\"bottomLeft\" state=\"frozen\"/></sheetView></sheetViews>");
        }
        writer.write("<sheetFormatPr defaultColWidth=\"" + COLUMN_WIDTH + "\" defaultRowHeight=\"11.25\"/>");
        writer.write("<sheetData>");
        int r = 0;
        int headerCols = 0;
        while (rows.hasNext()) {
            List<String> row = rows.next();
            r++;
            if (r == 1) headerCols = row.size();
            writer.write("<row r=\"" + r + "\">");
            for (int c = 0; c < row.size(); c++) {
                String v = row.get(c);
                if (v == null || v.isEmpty()) continue;
                String ref = colRef(c + 1) + r;
                String style = headerRow && r == 1 ? " s=\"1\"" : "";
                if (NUMBER.matcher(v).matches()) {
                    writer.write("<c r=\"" + ref + "\"" + style + "><v>" + v + "</v></c>");
                } else {
                    writer.write("<c r=\"" + ref + "\" t=\"inlineStr\"" + style + "><is><t>" + xmlEscape(v) + "</t></is></c>");
                }
            }
            writer.write("</row>");
        }
        writer.write("</sheetData>");
        if (headerRow && headerCols > 0) {
            writer.write("<autoFilter ref=\"A1:" + colRef(headerCols) + "1\"/>");
        }
        writer.write("</worksheet>");
        writer.flush();
        zip.closeEntry();
    }

    @Override
    public void close() throws IOException {
        putEntry("[Content_Types].xml", contentTypesXml());
        putEntry("_rels/.rels", "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\"><Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument\" Target=\"xl/workbook.xml\"/></Relationships>");
        putEntry("xl/workbook.xml", workbookXml());
        putEntry("xl/_rels/workbook.xml.rels", workbookRelsXml());
        putEntry("xl/styles.xml", stylesXml());
        writer.close();
    }

    private void putEntry(String name, String xml) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        writer.write(xml);
        writer.flush();
        zip.closeEntry();
    }

    private String contentTypesXml() {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">");
        sb.append("<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>");
        sb.append("<Default Extension=\"xml\" ContentType=\"application/xml\"/>");
        sb.append("<Override PartName=\"/xl/workbook.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml\"/>");
        sb.append("<Override PartName=\"/xl/styles.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.styles+xml\"/>");
        for (int i = 1; i <= sheetNames.size(); i++) {
            sb.append("<Override PartName=\"/xl/worksheets/sheet").append(i)
              .append(".xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml\"/>");
        }
        sb.append("</Types>");
        return sb.toString();
    }

    private String workbookXml() {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<workbook xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\" xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\">");
        sb.append("<sheets>");
        for (int i = 0; i < sheetNames.size(); i++) {
            sb.append("<sheet name=\"").append(xmlEscape(sheetNames.get(i))).append("\" sheetId=\"").append(i + 1)
              .append("\" r:id=\"rId").append(i + 1).append("\"/>");
        }
        sb.append("</sheets></workbook>");
        return sb.toString();
    }

    private String workbookRelsXml() {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">");
        for (int i = 1; i <= sheetNames.size(); i++) {
            sb.append("<Relationship Id=\"rId").append(i)
              .append("\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/worksheet\" Target=\"worksheets/sheet")
              .append(i).append(".xml\"/>");
        }
        // styles relationship as the last one
        sb.append("<Relationship Id=\"rId").append(sheetNames.size() + 1)
          .append("\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/styles\" Target=\"styles.xml\"/>");
        sb.append("</Relationships>");
        return sb.toString();
    }

    private static String stylesXml() {
        // 2 fonts (normal, bold), 2 cellXfs (normal idx0, header idx1)
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<styleSheet xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\">"
                + "<fonts count=\"2\">"
                + "<font><sz val=\"" + FONT_SIZE + "\"/><name val=\"Calibri\"/></font>"
                + "<font><b/><sz val=\"" + FONT_SIZE + "\"/><name val=\"Calibri\"/></font>"
                + "</fonts>"
                + "<fills count=\"2\"><fill><patternFill patternType=\"none\"/></fill><fill><patternFill patternType=\"gray125\"/></fill></fills>"
                + "<borders count=\"1\"><border/></borders>"
                + "<cellStyleXfs count=\"1\"><xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\"/></cellStyleXfs>"
                + "<cellXfs count=\"2\">"
                + "<xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\" xfId=\"0\"/>"
                + "<xf numFmtId=\"0\" fontId=\"1\" fillId=\"0\" borderId=\"0\" xfId=\"0\" applyFont=\"1\"/>"
                + "</cellXfs>"
                + "</styleSheet>";
    }

    static String colRef(int col) {
        StringBuilder sb = new StringBuilder();
        int n = col;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.toString();
    }

    static String xmlEscape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> {
                    // control characters other than tab, LF and CR are not allowed in XML 1.0
                    if (c >= 0x20 || c == '\t' || c == '\n' || c == '\r') sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
