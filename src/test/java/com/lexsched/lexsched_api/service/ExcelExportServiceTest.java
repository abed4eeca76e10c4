package com.lexsched.lexsched_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalTime;
import java.util.List;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Sheet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.lexsched.lexsched_api.model.DayPattern;
import com.lexsched.lexsched_api.model.RunStatus;
import com.lexsched.lexsched_api.model.ScheduleRun;
import com.lexsched.lexsched_api.model.ScheduleView;
import com.lexsched.lexsched_api.model.ScheduledClass;

class ExcelExportServiceTest {

    private final ExcelExportService service = new ExcelExportService();

    private static ScheduledClass row(String course, String days, int hour) {
        return ScheduledClass.builder().courseId(course).instructorId("smith").enrollment(12)
                .roomId("hall").timeSlotId(days + hour).dayPattern(days).days(DayPattern.parse(days))
                .startTime(LocalTime.of(hour, 0)).endTime(LocalTime.of(hour, 50)).build();
    }

    @Test
    @DisplayName("one schedule row per meeting day, ordered by day")
    void writesScheduleSheet() throws IOException {
        ScheduleRun run = ScheduleRun.started("run-1").withStatus(RunStatus.DONE)
                .withView(ScheduleView.of(List.of(row("bio", "TTH", 10), row("chem", "MW", 9))));

        ByteArrayInputStream xls = service.generateScheduleExcel(run);

        try (HSSFWorkbook workbook = new HSSFWorkbook(xls)) {
            Sheet sheet = workbook.getSheet("Schedule");
            assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Schedule run-1");
            assertThat(sheet.getRow(2).getCell(2).getStringCellValue()).isEqualTo("Course");
            assertThat(sheet.getLastRowNum()).isEqualTo(6);
            assertThat(sheet.getRow(3).getCell(0).getStringCellValue()).isEqualTo("Monday");
            assertThat(sheet.getRow(3).getCell(2).getStringCellValue()).isEqualTo("chem");
            assertThat(sheet.getRow(3).getCell(1).getStringCellValue()).isEqualTo("09:00 AM - 09:50 AM");
            assertThat(sheet.getRow(4).getCell(0).getStringCellValue()).isEqualTo("Tuesday");
            assertThat(sheet.getRow(6).getCell(0).getStringCellValue()).isEqualTo("Thursday");
            assertThat(workbook.getSheet("Stages")).isNotNull();
        }
        assertThat(service.getExcelFilename(run)).isEqualTo("Schedule_run-1.xls");
    }

    @Test
    void refusesRunsWithoutSchedule() {
        ScheduleRun failed = ScheduleRun.started("run-2").withStatus(RunStatus.FAILED);

        assertThatThrownBy(() -> service.generateScheduleExcel(failed))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FAILED");
    }
}
