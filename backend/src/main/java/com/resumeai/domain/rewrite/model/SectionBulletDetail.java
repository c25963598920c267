package com.resumeai.domain.rewrite.model;

public record SectionBulletDetail(int index, RewriteResult bulletResult) {
}
