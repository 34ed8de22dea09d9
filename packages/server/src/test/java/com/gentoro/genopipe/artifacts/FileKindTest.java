package com.gentoro.genopipe.artifacts;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.jobs.JobType;
import org.junit.jupiter.api.Test;

class FileKindTest {

  @Test
  void parsesWireNames() {
    assertEquals(FileKind.RESFINDER_CSV, FileKind.fromWireName("resfinder_csv"));
    assertEquals(FileKind.PHASTEST_ZIP, FileKind.fromWireName(" PHASTEST_ZIP "));
    assertEquals(FileKind.VFDB_EXCEL, FileKind.fromWireName("vfdb_excel"));
  }

  @Test
  void legacyVfdbNameMapsToWorkbook() {
    assertEquals(FileKind.VFDB_EXCEL, FileKind.fromWireName("vfdb_csv"));
  }

  @Test
  void rejectsUnknownOrMissingNames() {
    assertThrows(ValidationException.class, () -> FileKind.fromWireName("pdf_report"));
    assertThrows(ValidationException.class, () -> FileKind.fromWireName(""));
    assertThrows(ValidationException.class, () -> FileKind.fromWireName(null));
  }

  @Test
  void filenamesAreDeterministic() {
    assertEquals("resfinder_results.csv", FileKind.RESFINDER_CSV.filename("abc"));
    assertEquals("phastest_results_abc.zip", FileKind.PHASTEST_ZIP.filename("abc"));
    assertEquals("vfdb_results.xlsx", FileKind.VFDB_EXCEL.filename("abc"));
    assertEquals(JobType.PHASTEST, FileKind.PHASTEST_CSV.jobType());
  }
}
