package com.kidsmap.datablock.dto.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kidsmap.datablock.entity.CrawlFailureReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.PrintWriter;
import java.io.Serializable;
import java.io.StringWriter;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlError implements Serializable {

    private static final int MAX_STACK_LENGTH = 4000;

    private String code;

    private String message;

    private String stack;

    private List<String> failedItems;

    public static CrawlError from(Throwable e) {
        StringWriter writer = new StringWriter();
        e.printStackTrace(new PrintWriter(writer));
        String stack = writer.toString();
        if (stack.length() > MAX_STACK_LENGTH) {
            stack = stack.substring(0, MAX_STACK_LENGTH);
        }
        return CrawlError.builder()
                .code(CrawlFailureReason.fromException(e).getCode())
                .message(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .stack(stack)
                .build();
    }
}
