package com.lexsched.lexsched_api.service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.lexsched.lexsched_api.model.ClockTime;
import com.lexsched.lexsched_api.model.RunStatus;
import com.lexsched.lexsched_api.model.ScheduleRun;
import com.lexsched.lexsched_api.model.ScheduledClass;
import com.lexsched.lexsched_api.solver.engine.StageResult;

/**
 * Renders a finished run as an .xls workbook: one "Schedule" sheet listing every meeting by
 * day and time, and one "Stages" sheet with the value reached for each objective.
 */
@Service
public class ExcelExportService {

    private static final Logger logger = LoggerFactory.getLogger(ExcelExportService.class);

    private static final String[] SCHEDULE_COLUMNS = {"Day", "Time", "Course", "Instructor", "Room", "Enrollment"};
    private static final String[] STAGE_COLUMNS = {"Stage", "Objective", "Sense", "Value", "Tolerance", "Frozen Bound"};

    private static final List<BiConsumer<CellStyle, BorderStyle>> BORDER_SIDES = List.of(
            CellStyle::setBorderTop, CellStyle::setBorderBottom, CellStyle::setBorderLeft, CellStyle::setBorderRight);

    public String getExcelFilename(ScheduleRun run) {
        String safeId = run.getProblemId().replaceAll("[^a-zA-Z0-9\\-_]", "");
        return String.format("Schedule_%s.xls", safeId);
    }

    public ByteArrayInputStream generateScheduleExcel(ScheduleRun run) throws IOException {
        if (run.getStatus() != RunStatus.DONE || run.getView() == null) {
            throw new IllegalArgumentException("Run " + run.getProblemId() + " has no schedule to export (status "
                    + run.getStatus() + ").");
        }
        logger.info("Generating Excel schedule for problemId: {}", run.getProblemId());

        try (Workbook workbook = new HSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            CellStyle headerStyle = cellStyle(workbook, true, true, IndexedColors.SEA_GREEN);
            CellStyle dayStyle = cellStyle(workbook, true, false, null);
            CellStyle centeredStyle = cellStyle(workbook, false, true, null);

            Sheet sheet = workbook.createSheet("Schedule");
            sheet.setDefaultColumnWidth(20);
            writeTitle(workbook, sheet, "Schedule " + run.getProblemId(), SCHEDULE_COLUMNS.length);
            writeHeader(sheet, SCHEDULE_COLUMNS, headerStyle);

            int rowIdx = 3;
            for (Map.Entry<DayOfWeek, List<ScheduledClass>> day : run.getView().byDay().entrySet()) {
                for (ScheduledClass scheduled : day.getValue()) {
                    Row row = sheet.createRow(rowIdx++);

                    Cell dayCell = row.createCell(0);
                    dayCell.setCellValue(day.getKey().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
                    dayCell.setCellStyle(dayStyle);

                    Cell timeCell = row.createCell(1);
                    timeCell.setCellValue(String.format("%s - %s", ClockTime.DISPLAY.format(scheduled.getStartTime()),
                            ClockTime.DISPLAY.format(scheduled.getEndTime())));
                    timeCell.setCellStyle(centeredStyle);

                    row.createCell(2).setCellValue(scheduled.getCourseId());
                    row.createCell(3).setCellValue(scheduled.getInstructorId());
                    row.createCell(4).setCellValue(scheduled.getRoomId());
                    Cell enrollmentCell = row.createCell(5);
                    enrollmentCell.setCellValue(scheduled.getEnrollment());
                    enrollmentCell.setCellStyle(centeredStyle);
                }
            }

            Sheet stages = workbook.createSheet("Stages");
            stages.setDefaultColumnWidth(24);
            writeTitle(workbook, stages, "Objectives in priority order", STAGE_COLUMNS.length);
            writeHeader(stages, STAGE_COLUMNS, headerStyle);
            rowIdx = 3;
            for (StageResult stage : run.getStages()) {
                Row row = stages.createRow(rowIdx++);
                row.createCell(0).setCellValue(stage.getIndex());
                row.createCell(1).setCellValue(stage.getObjectiveName());
                row.createCell(2).setCellValue(stage.getSense().name());
                row.createCell(3).setCellValue(stage.getAchievedValue());
                row.createCell(4).setCellValue(stage.getTolerance());
                row.createCell(5).setCellValue(stage.isFrozen()
                        ? stage.getFrozenBound().getRelation().getSymbol() + " " + stage.getFrozenBound().getBound()
                        : "-");
            }

            workbook.write(out);
            logger.info("Excel file generated for problemId: {} ({} classes)", run.getProblemId(),
                    run.getView().getRows().size());
            return new ByteArrayInputStream(out.toByteArray());
        } catch (IOException e) {
            logger.error("Error generating Excel for problemId {}: {}", run.getProblemId(), e.getMessage());
            throw e;
        }
    }

    private void writeTitle(Workbook workbook, Sheet sheet, String title, int columns) {
        Cell cell = sheet.createRow(0).createCell(0);
        cell.setCellValue(title);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font(workbook, true, (short) 14, null));
        style.setAlignment(HorizontalAlignment.CENTER);
        cell.setCellStyle(style);
        sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, columns - 1));
    }

    private void writeHeader(Sheet sheet, String[] columns, CellStyle headerStyle) {
        Row header = sheet.createRow(2);
        for (int col = 0; col < columns.length; col++) {
            Cell cell = header.createCell(col);
            cell.setCellValue(columns[col]);
            cell.setCellStyle(headerStyle);
        }
    }

    /**
     * Thin-bordered cell style. {@code fill} is a background colour, or null for none.
     */
    private CellStyle cellStyle(Workbook workbook, boolean bold, boolean centered, IndexedColors fill) {
        CellStyle style = workbook.createCellStyle();
        if (bold) {
            style.setFont(font(workbook, true, null, fill != null ? IndexedColors.WHITE : null));
        }
        if (fill != null) {
            style.setFillForegroundColor(fill.getIndex());
            style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        }
        if (centered) {
            style.setAlignment(HorizontalAlignment.CENTER);
            style.setVerticalAlignment(VerticalAlignment.CENTER);
        }
        BORDER_SIDES.forEach(side -> side.accept(style, BorderStyle.THIN));
        return style;
    }

    private Font font(Workbook workbook, boolean bold, Short points, IndexedColors colour) {
        Font font = workbook.createFont();
        font.setBold(bold);
        if (points != null) {
            font.setFontHeightInPoints(points);
        }
        if (colour != null) {
            font.setColor(colour.getIndex());
        }
        return font;
    }
}
