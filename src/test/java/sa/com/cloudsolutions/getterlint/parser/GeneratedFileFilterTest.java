package sa.com.cloudsolutions.getterlint.parser;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.comments.BlockComment;
import org.junit.jupiter.api.Test;
import sa.com.cloudsolutions.getterlint.analysis.RuleConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeneratedFileFilterTest {
    private final GeneratedFileFilter filter = new GeneratedFileFilter(RuleConfig.DEFAULT_GENERATED_PREFIXES);

    @Test
    void lineCommentHeader() {
        CompilationUnit cu = StaticJavaParser.parse("""
                // Code generated by protoc-gen-x. DO NOT EDIT.
                package a;
                class A {}
                """);
        assertTrue(filter.isGenerated(cu));
    }

    @Test
    void blockCommentHeader() {
        CompilationUnit cu = StaticJavaParser.parse("""
                /**
                 * Autogenerated by Thrift Compiler (0.19.0)
                 *
                 * DO NOT EDIT UNLESS YOU ARE SURE THAT YOU KNOW WHAT YOU ARE DOING
                 */
                package a;
                class A {}
                """);
        assertTrue(filter.isGenerated(cu));
    }

    @Test
    void generatedAnnotation() {
        CompilationUnit cu = StaticJavaParser.parse("""
                package a;
                @javax.annotation.Generated("tool")
                class A {}
                """);
        assertTrue(filter.isGenerated(cu));
    }

    @Test
    void handWrittenFiles() {
        CompilationUnit cu = StaticJavaParser.parse("""
                // This code generated a lot of discussion.
                package a;
                /** Not Code generated, just documented. */
                class A {
                    @Deprecated
                    void m() {}
                }
                """);
        assertFalse(filter.isGenerated(cu));
    }

    @Test
    void retainHandWritten() {
        CompilationUnit generated = StaticJavaParser.parse("// Code generated. DO NOT EDIT.\nclass G {}");
        CompilationUnit written = StaticJavaParser.parse("class W {}");
        assertEquals(List.of(written), filter.retainHandWritten(List.of(generated, written)));
    }

    @Test
    void commentTextDropsDecoration() {
        BlockComment comment = new BlockComment("*\n   * Generated by the protocol buffer compiler.\n   ");
        assertEquals("Generated by the protocol buffer compiler.", GeneratedFileFilter.commentText(comment));
    }
}
