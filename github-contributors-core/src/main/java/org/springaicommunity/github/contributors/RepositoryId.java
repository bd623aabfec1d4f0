package org.springaicommunity.github.contributors;

/**
 * A GitHub repository coordinate in {@code owner/name} form.
 *
 * @param owner the user or organization
 * @param name the repository name
 */
public record RepositoryId(String owner, String name) {

	public RepositoryId {
		if (owner.isBlank() || name.isBlank()) {
			throw new IllegalArgumentException("Repository owner and name must not be blank");
		}
	}

	/**
	 * Parse a repository in {@code owner/name} format.
	 * @param repository the coordinate, surrounding whitespace ignored
	 * @return the parsed id
	 * @throws IllegalArgumentException if the value is not exactly {@code owner/name}
	 */
	public static RepositoryId parse(String repository) {
		String[] parts = repository.trim().split("/", -1);
		if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
			throw new IllegalArgumentException(
					"Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai'): " + repository);
		}
		return new RepositoryId(parts[0].trim(), parts[1].trim());
	}

	public String fullName() {
		return owner + "/" + name;
	}

	/**
	 * REST path of the commit listing for this repository.
	 */
	public String commitsPath() {
		return "/repos/" + owner + "/" + name + "/commits";
	}

	@Override
	public String toString() {
		return fullName();
	}

}
