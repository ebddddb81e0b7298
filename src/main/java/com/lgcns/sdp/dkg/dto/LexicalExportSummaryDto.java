package com.lgcns.sdp.dkg.dto;

/**
 * 렉시컬 스트림의 마지막 줄. 이 줄이 없으면 중간에 끊긴 스트림이다.
 */
public record LexicalExportSummaryDto(long count) {
}
