package com.example.guestcode.service;

import com.example.guestcode.model.Booking;
import com.example.guestcode.service.exception.BookingSourceException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads bookings from the first sheet of an XLSX export. The header row is
 * found by its two column titles, dates are read day-first.
 */
@Slf4j
@Component
public class BookingSheetParser {

    private static final List<DateTimeFormatter> DAY_FIRST = List.of(
            strict("d.M.uuuu"), strict("d-M-uuuu"), strict("d/M/uuuu"),
            strict("d.M.uu"), strict("d-M-uu"), strict("d/M/uu"),
            strict("uuuu-M-d"), strict("uuuu/M/d"));

    private final String arrivalColumn;
    private final String departureColumn;
    private final int headerScanRows;
    private final DataFormatter formatter = new DataFormatter();

    public BookingSheetParser(@Value("${bookings.column.arrival}") String arrivalColumn,
                              @Value("${bookings.column.departure}") String departureColumn,
                              @Value("${bookings.header-scan-rows}") int headerScanRows) {
        this.arrivalColumn = arrivalColumn.trim();
        this.departureColumn = departureColumn.trim();
        this.headerScanRows = headerScanRows;
    }

    public List<Booking> parse(byte[] workbookBytes) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(workbookBytes))) {
            return parse(workbook.getSheetAt(0));
        } catch (IOException | EncryptedDocumentException | UnsupportedFileFormatException e) {
            throw new BookingSourceException("Booking file is not a readable workbook: " + e.getMessage(), e);
        }
    }

    List<Booking> parse(Sheet sheet) {
        HeaderRow header = findHeader(sheet);
        List<Booking> bookings = new ArrayList<>();
        int dropped = 0;

        for (int r = header.rowIndex() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null || isBlank(row)) {
                continue;
            }
            LocalDate arrival = dateAt(row, header.arrivalColumn());
            LocalDate departure = dateAt(row, header.departureColumn());
            if (arrival == null || departure == null || !departure.isAfter(arrival)) {
                dropped++;
                continue;
            }
            bookings.add(new Booking(arrival, departure));
        }

        if (dropped > 0) {
            log.debug("Dropped {} incomplete or invalid booking row(s)", dropped);
        }
        return bookings;
    }

    private HeaderRow findHeader(Sheet sheet) {
        String arrivalKey = arrivalColumn.toLowerCase(Locale.ROOT);
        String departureKey = departureColumn.toLowerCase(Locale.ROOT);
        int lastRow = Math.min(headerScanRows, sheet.getLastRowNum() + 1);

        for (int r = 0; r < lastRow; r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            int arrivalIndex = -1;
            int departureIndex = -1;
            for (Cell cell : row) {
                String title = formatter.formatCellValue(cell).trim().toLowerCase(Locale.ROOT);
                if (arrivalIndex < 0 && title.equals(arrivalKey)) {
                    arrivalIndex = cell.getColumnIndex();
                } else if (departureIndex < 0 && title.equals(departureKey)) {
                    departureIndex = cell.getColumnIndex();
                }
            }
            if (arrivalIndex >= 0 && departureIndex >= 0) {
                return new HeaderRow(r, arrivalIndex, departureIndex);
            }
        }
        throw new BookingSourceException("Header row with columns '" + arrivalColumn + "' and '"
                + departureColumn + "' not found in the first " + headerScanRows + " rows");
    }

    private LocalDate dateAt(Row row, int column) {
        Cell cell = row.getCell(column);
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case NUMERIC -> {
                double value = cell.getNumericCellValue();
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue().toLocalDate();
                }
                yield DateUtil.isValidExcelDate(value) ? DateUtil.getLocalDateTime(value).toLocalDate() : null;
            }
            case STRING -> parseDayFirst(cell.getStringCellValue());
            default -> null;
        };
    }

    /** Day-first text date, a trailing time part is ignored. {@code null} if unreadable. */
    static LocalDate parseDayFirst(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        int timeStart = indexOfTimePart(text);
        if (timeStart >= 0) {
            text = text.substring(0, timeStart);
        }
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DAY_FIRST) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException e) {
                log.trace("'{}' is not {}", text, format);
            }
        }
        return null;
    }

    private static int indexOfTimePart(String text) {
        int space = text.indexOf(' ');
        int iso = text.indexOf('T');
        if (space < 0) {
            return iso;
        }
        return iso < 0 ? space : Math.min(space, iso);
    }

    private boolean isBlank(Row row) {
        for (Cell cell : row) {
            if (!formatter.formatCellValue(cell).isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    private record HeaderRow(int rowIndex, int arrivalColumn, int departureColumn) {}
}
