package com.ogt.crm.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ColumnProfile {
    int index;
    String header;
    ColumnDataType dataType;
    List<String> sampleValues; // hasta 3 ejemplos
    int nonEmptyCount;         // sobre las primeras 100 filas de datos
}
