package com.pulselang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    /** 断言单个 token 的类型和字面量 */
    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与小数")
        void testNumbers() {
            assertSingleToken("42", TokenType.INT_LITERAL, 42);
            assertSingleToken("3.25", TokenType.DOUBLE_LITERAL, 3.25);
        }

        @Test
        @DisplayName("超出 int 范围的整数按 double 处理")
        void testIntOverflow() {
            assertSingleToken("3000000000", TokenType.DOUBLE_LITERAL, 3.0E9);
        }

        @Test
        @DisplayName("数字后的点不是小数点")
        void testDotAfterNumber() {
            assertEquals(List.of(TokenType.INT_LITERAL, TokenType.DOT, TokenType.IDENTIFIER),
                    types("1.x"));
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            assertSingleToken("\"a\\n\\t\\\"b\\\\\"", TokenType.STRING_LITERAL, "a\n\t\"b\\");
            assertSingleToken("\"it\\'s\\0\"", TokenType.STRING_LITERAL, "it's\0");
        }

        @Test
        @DisplayName("未知转义原样保留")
        void testUnknownEscape() {
            assertSingleToken("\"\\q\"", TokenType.STRING_LITERAL, "\\q");
        }

        @Test
        @DisplayName("未闭合的字符串抛出 LexException")
        void testUnterminatedString() {
            LexException e = assertThrows(LexException.class, () -> scan("int x = 1;\nString s = \"abc"));
            assertEquals(2, e.getLine());
            assertEquals(12, e.getColumn());
            assertEquals("Unterminated string", e.getRawMessage());
            assertTrue(e.getMessage().contains("at line 2, column 12"));
        }

        @Test
        @DisplayName("字符串中的换行视为未闭合")
        void testNewlineInString() {
            assertThrows(LexException.class, () -> scan("\"abc\ndef\""));
        }
    }

    @Nested
    @DisplayName("关键词与注解")
    class KeywordTests {

        @Test
        @DisplayName("类型关键词")
        void testTypeKeywords() {
            assertEquals(List.of(TokenType.KW_INT, TokenType.KW_DOUBLE, TokenType.KW_BOOLEAN,
                    TokenType.KW_STRING, TokenType.KW_VOID), types("int double boolean String void"));
        }

        @Test
        @DisplayName("标识符允许 $ 和 _")
        void testIdentifierChars() {
            assertSingleToken("_sensor$1", TokenType.IDENTIFIER, null);
        }

        @Test
        @DisplayName("专用注解各自成为一个 token")
        void testDedicatedAnnotations() {
            assertEquals(List.of(TokenType.ANN_DEADLINE, TokenType.ANN_SENSOR,
                    TokenType.ANN_SAFETY_CHECK, TokenType.ANN_REAL_TIME),
                    types("@Deadline @Sensor @SafetyCheck @RealTime"));
        }

        @Test
        @DisplayName("其他注解为通用 ANNOTATION，字面量为名称")
        void testGenericAnnotation() {
            assertSingleToken("@Override", TokenType.ANNOTATION, "Override");
        }

        @Test
        @DisplayName("注解参数拆分为独立 token")
        void testAnnotationArgs() {
            assertEquals(List.of(TokenType.ANN_DEADLINE, TokenType.LPAREN, TokenType.IDENTIFIER,
                    TokenType.ASSIGN, TokenType.INT_LITERAL, TokenType.RPAREN),
                    types("@Deadline(ms=5)"));
        }
    }

    @Nested
    @DisplayName("操作符")
    class OperatorTests {

        @Test
        @DisplayName("多字符操作符")
        void testCompoundOperators() {
            assertEquals(List.of(TokenType.INC, TokenType.DEC, TokenType.EQ, TokenType.NE,
                    TokenType.LE, TokenType.GE, TokenType.AND, TokenType.OR),
                    types("++ -- == != <= >= && ||"));
        }

        @Test
        @DisplayName("单个 & 产生 ERROR token 而不中断扫描")
        void testSingleAmpersand() {
            List<Token> toks = tokens("a & b");
            assertEquals(3, toks.size());
            assertEquals(TokenType.ERROR, toks.get(1).getType());
            assertEquals(TokenType.IDENTIFIER, toks.get(2).getType());
        }

        @Test
        @DisplayName("无法识别的字符产生 ERROR token")
        void testUnknownCharacter() {
            List<Token> toks = tokens("x # y");
            assertEquals(TokenType.ERROR, toks.get(1).getType());
            assertEquals("#", toks.get(1).getLexeme());
        }
    }

    @Nested
    @DisplayName("注释")
    class CommentTests {

        @Test
        @DisplayName("行注释与块注释保留为 COMMENT")
        void testComments() {
            assertEquals(List.of(TokenType.COMMENT, TokenType.IDENTIFIER, TokenType.COMMENT),
                    types("// line\nx /* block\n comment */"));
        }

        @Test
        @DisplayName("块注释跨行后行号正确")
        void testLineAfterBlockComment() {
            List<Token> toks = tokens("/* a\nb\nc */ x");
            assertEquals(3, toks.get(1).getLine());
        }

        @Test
        @DisplayName("未闭合的块注释延伸到输入末尾")
        void testUnclosedBlockComment() {
            List<Token> toks = tokens("x /* never closed\n y");
            assertEquals(2, toks.size());
            assertEquals(TokenType.COMMENT, toks.get(1).getType());
            assertEquals("/* never closed\n y", toks.get(1).getLexeme());
        }
    }

    @Nested
    @DisplayName("位置信息")
    class SpanTests {

        private static final String PROGRAM = "@Deadline(ms=5)\n"
                + "public void read() {\n"
                + "    int t = 25; // temperature\n"
                + "    String s = \"T:\\\"\" + t;\n"
                + "    /* done */\n"
                + "}\n";

        @Test
        @DisplayName("offset/length 精确覆盖 lexeme")
        void testSpansCoverLexemes() {
            for (Token token : scan(PROGRAM)) {
                assertEquals(token.getLexeme(),
                        PROGRAM.substring(token.getOffset(), token.getOffset() + token.getLength()),
                        "span of " + token);
            }
        }

        @Test
        @DisplayName("token 之间只有空白")
        void testGapsAreWhitespace() {
            int end = 0;
            for (Token token : scan(PROGRAM)) {
                String gap = PROGRAM.substring(end, token.getOffset());
                assertTrue(gap.trim().isEmpty(), "non-whitespace gap before " + token);
                end = token.getEndOffset();
            }
            assertEquals(PROGRAM.length(), end);
        }

        @Test
        @DisplayName("行列号从 1 开始")
        void testLineAndColumn() {
            List<Token> toks = tokens("int x;\n  x = 1;");
            Token secondX = toks.get(3);
            assertEquals("x", secondX.getLexeme());
            assertEquals(2, secondX.getLine());
            assertEquals(3, secondX.getColumn());
        }

        @Test
        @DisplayName("EOF 总在末尾")
        void testEof() {
            List<Token> all = scan("");
            assertEquals(1, all.size());
            assertEquals(TokenType.EOF, all.get(0).getType());
        }
    }
}
