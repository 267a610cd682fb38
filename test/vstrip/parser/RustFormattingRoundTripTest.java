package vstrip.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import vstrip.model.rust.RustSourceUnit;
import vstrip.trans.StripPipeline;

/**
 * Parses source text already in canonical layout and checks that printing the
 * tree gives the same text back.
 */
@RunWith(Parameterized.class)
public class RustFormattingRoundTripTest {

	static Path testFile = Paths.get("TEST");

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "fn main() {}\n" },
			{ "pub(crate) fn add(a: i32, b: i32) -> i32 {\n    a + b\n}\n" },
			{ "struct Point {\n    x: i32,\n    pub y: i32,\n}\n" },
			{ "struct Pair(u32, u64);\n" },
			{ "struct Marker;\n" },
			{ "use std::collections::{HashMap, HashSet};\n" },
			{ "use std::io::Write as W;\n" },
			{ "const N: usize = 10;\n" },
			{ "static mut COUNT: u32 = 0;\n" },
			{ "mod inner;\n" },
			{ "mod outer {\n    fn f() {}\n}\n" },
			{ "enum Tree<T> {\n    Leaf,\n    Node(Box<Tree<T>>, T),\n}\n" },
			{ "type Table = HashMap<String, Vec<u8>>;\n" },
			{ "trait Shape: Debug {\n    fn area(&self) -> f64;\n}\n" },
			{ "impl<T: Clone> Stack<T> {\n    fn push(&mut self, t: T) {\n        self.items.push(t);\n    }\n}\n" },
			{ "fn f(x: Option<u32>) -> u32 {\n    if let Some(y) = x {\n        y\n    } else {\n        0\n    }\n}\n" },
			{ "fn f() {\n    let v = vec![1, 2, 3];\n    for x in v.iter() {\n        println!(\"{}\", x);\n    }\n}\n" },
			{ "fn f<'a>(s: &'a str) -> &'a str {\n    &s[1..]\n}\n" },
			{ "fn f() -> Result<(), String> {\n    let x = g()?;\n    Ok(x)\n}\n" },
			{ "fn f(x: u32) -> u32 {\n    match x {\n        0 | 1 => 1,\n        n => n * f(n - 1),\n    }\n}\n" },
			{ "fn f() {\n    let c = |a, b| a + b;\n    let m = move || 1;\n}\n" },
			{ "fn f() {\n    'outer: loop {\n        break 'outer;\n    }\n}\n" },
			{ "fn f(p: Point) -> i32 {\n    let Point { x, y: _ } = p;\n    x\n}\n" },
			{ "fn f() -> S {\n    S { a: 1, ..Default::default() }\n}\n" },
			{ "fn f() -> [u8; 4] {\n    [0; 4]\n}\n" },
			{ "fn f() {\n    unsafe {\n        g();\n    }\n}\n" },
			{ "fn f(x: &mut Vec<u8>) {\n    x.push(b'a');\n}\n" },
			{ "fn f() {\n    let t = (1, \"a\");\n    let u = (t.0,);\n}\n" },
			{ "fn f() {\n    return;\n}\n" },
			{ "#[derive(Debug)]\nstruct Empty {}\n" },
			{ "#![allow(dead_code)]\nfn f() {}\n" },
			// the verification dialect
			{ "spec fn double(x: int) -> int {\n    x + x\n}\n" },
			{ "pub open spec fn visible(x: int) -> bool {\n    x > 0\n}\n" },
			{ "proof fn lemma(x: int)\n    requires x > 0\n    ensures x >= 1\n{}\n" },
			{ "fn div(a: u32, b: u32) -> (r: u32)\n    requires b > 0\n{\n    a / b\n}\n" },
			{ "fn f(Ghost(g): Ghost<int>, tracked t: Perm) {}\n" },
			{ "struct S {\n    ghost g: int,\n    tracked t: Perm,\n}\n" },
			{ "fn f(v: Vec<u8>) {\n    let ghost s = v@;\n    let tracked p = make();\n}\n" },
			{ "proof fn f(x: int) {\n    assert(x == x) by {\n        lemma(x);\n    }\n}\n" },
			{ "proof fn f() {\n    assert forall|i: int| i > 0 implies i >= 1 by {}\n}\n" },
			{ "spec fn all_pos(s: Seq<int>) -> bool {\n    forall|i: int| s[i] > 0\n}\n" },
			{ "spec fn f(a: bool, b: bool) -> bool {\n    a ==> b\n}\n" },
			{ "fn f() {\n    proof {\n        assume(false);\n    }\n}\n" },
			{ "broadcast use group_axioms;\n" },
			{ "exec const LIMIT: u64 = 8;\n" },
			{ "spec fn apply(f: spec_fn(int) -> int) -> int {\n    f(1)\n}\n" },
			{ "spec fn holds(p: FnSpec(int, int) -> bool) -> bool {\n    p(0, 1)\n}\n" },
			{ "proof fn mul_pos(x: int, y: int) by (nonlinear_arith)\n    requires x > 0, y > 0\n    ensures x * y > 0\n{}\n" },
			{ "spec fn is_some(o: Option<int>) -> bool {\n    o matches Some(x)\n}\n" },
			{ "spec fn positive(o: Option<int>) -> bool {\n    o matches Some(x) && x > 0\n}\n" },
			{ "fn f(n: u32) {\n    for j in it: 0..n\n        invariant j <= n\n    {\n        g(j);\n    }\n}\n" },
		});
	}

	private String source;

	public RustFormattingRoundTripTest(String source) {
		this.source = source;
	}

	@Test
	public void test() throws ParseFailureException {
		RustSourceUnit sourceUnit = RustParser.readSourceUnit(testFile, source);
		assertThat(StripPipeline.format(sourceUnit), is(source));
	}

}
