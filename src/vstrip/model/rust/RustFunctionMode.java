package vstrip.model.rust;

public enum RustFunctionMode {
	DEFAULT(""),
	EXEC("exec"),
	SPEC("spec"),
	SPEC_CHECKED("spec(checked)"),
	PROOF("proof"),
	PROOF_AXIOM("axiom");

	private final String keyword;

	RustFunctionMode(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}

	public boolean isExecutable() {
		return this == DEFAULT || this == EXEC;
	}
}
