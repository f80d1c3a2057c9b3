package com.whereq.newscaster.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Narration script produced for one item
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Script {

    private String title;

    private String text;
}
