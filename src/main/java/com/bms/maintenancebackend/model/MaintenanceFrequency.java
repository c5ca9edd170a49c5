package com.bms.maintenancebackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceFrequency implements Serializable {
    private static final long serialVersionUID = 1L;

    private int interval;
    private FrequencyUnit unit;
}
