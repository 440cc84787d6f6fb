package org.lokray.tamodel.semantic.type;

public enum Qualifier
{
	CONST("const"),
	META("meta"),
	URGENT("urgent"),
	BROADCAST("broadcast"),
	// Reference parameter, written '&name'.
	REF("&");

	private final String keyword;

	Qualifier(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}
}
