package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.models.CellValue;
import com.sheetdoc.app.models.PageReference;

/**
 * How an expression reads the cells it references.
 */
interface CellValueProvider {

    Result<CellValue> local(String address);

    Result<CellValue> external(PageReference page, String address);
}
